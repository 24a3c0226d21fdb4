/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.repository;

import com.bonitaforward.account.registry.DeletionTarget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({RegistryJdbcRepository.class, JdbcAuthRecordStore.class})
class RegistryJdbcRepositoryTest {

    @Autowired
    private RegistryJdbcRepository registryJdbcRepository;

    @Autowired
    private JdbcAuthRecordStore authRecordStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("Should delete only rows keyed by the given identity")
    void shouldDeleteByIdentity() {
        var identityId = UUID.randomUUID();
        var otherId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO event_votes (user_id, event_id, vote) VALUES (?, 1, 1)", identityId);
        jdbcTemplate.update("INSERT INTO event_votes (user_id, event_id, vote) VALUES (?, 2, 1)", identityId);
        jdbcTemplate.update("INSERT INTO event_votes (user_id, event_id, vote) VALUES (?, 1, -1)", otherId);

        int removed = registryJdbcRepository.deleteByIdentity(DeletionTarget.EVENT_VOTES, identityId);

        assertEquals(2, removed);
        assertEquals(0, registryJdbcRepository.countByIdentity(DeletionTarget.EVENT_VOTES, identityId));
        assertEquals(1, registryJdbcRepository.countByIdentity(DeletionTarget.EVENT_VOTES, otherId));
    }

    @Test
    @DisplayName("Should match e-mail keyed rows regardless of stored case")
    void shouldDeleteByEmailIgnoringCase() {
        jdbcTemplate.update("INSERT INTO bookings (user_email) VALUES (?)", "Amy@Example.com");
        jdbcTemplate.update("INSERT INTO bookings (user_email) VALUES (?)", "amy@example.com");
        jdbcTemplate.update("INSERT INTO bookings (user_email) VALUES (?)", "bob@example.com");

        assertEquals(2, registryJdbcRepository.countByEmail(DeletionTarget.BOOKINGS, "amy@example.com"));
        assertEquals(2, registryJdbcRepository.deleteByEmail(DeletionTarget.BOOKINGS, "amy@example.com"));
        assertEquals(0, registryJdbcRepository.deleteByEmail(DeletionTarget.BOOKINGS, "amy@example.com"));
        assertEquals(1, registryJdbcRepository.countByEmail(DeletionTarget.BOOKINGS, "bob@example.com"));
    }

    @Test
    @DisplayName("Should refuse statements that do not fit the target's key")
    void shouldRejectMismatchedKeyType() {
        assertThrows(IllegalArgumentException.class,
                () -> registryJdbcRepository.deleteByIdentity(DeletionTarget.BOOKINGS, UUID.randomUUID()));
        assertThrows(IllegalArgumentException.class,
                () -> registryJdbcRepository.deleteByEmail(DeletionTarget.EVENT_VOTES, "amy@example.com"));
    }

    @Test
    @DisplayName("Probing a missing column should fail")
    void probeShouldFailForMissingColumn() {
        assertDoesNotThrow(() -> registryJdbcRepository.probeColumn("bookings", "user_email"));
        assertThrows(DataAccessException.class,
                () -> registryJdbcRepository.probeColumn("bookings", "guest_email"));
    }

    @Test
    @DisplayName("Removing an auth record twice should report it as already absent")
    void authRecordRemovalShouldBeIdempotent() {
        var identityId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO auth_users (id, email, created_at) VALUES (?, ?, ?)",
                identityId, "Amy@Example.com", Timestamp.from(Instant.now()));

        assertTrue(authRecordStore.exists(identityId));
        assertEquals(identityId, authRecordStore.findIdentityIdByEmail("amy@example.com").orElseThrow());
        assertEquals("Amy@Example.com", authRecordStore.findEmail(identityId).orElseThrow());

        assertEquals(AuthRecordStore.Removal.REMOVED, authRecordStore.remove(identityId));
        assertEquals(AuthRecordStore.Removal.ALREADY_ABSENT, authRecordStore.remove(identityId));
        assertFalse(authRecordStore.exists(identityId));
    }
}
