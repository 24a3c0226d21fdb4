/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.entity.BusinessListing;
import com.bonitaforward.account.entity.IdentityKind;
import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.registry.DeletionRegistry;
import com.bonitaforward.account.repository.JdbcAuthRecordStore;
import com.bonitaforward.account.repository.RegistryJdbcRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({IdentityResolver.class, DeletionRegistry.class, RegistryJdbcRepository.class, JdbcAuthRecordStore.class})
class IdentityResolverTest {

    @Autowired
    private IdentityResolver resolver;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("A profile should resolve as a full identity by id or by e-mail")
    void profileShouldResolveFull() {
        var id = UUID.randomUUID();
        entityManager.persistAndFlush(Profile.builder().id(id).email("amy@example.com").build());

        var byId = resolver.resolve(id.toString());
        var byEmail = resolver.resolve("  AMY@Example.com");

        assertEquals(IdentityKind.FULL, byId.kind());
        assertEquals(id, byId.identityId().orElseThrow());
        assertEquals("amy@example.com", byId.email());
        assertEquals(IdentityKind.FULL, byEmail.kind());
        assertEquals(id, byEmail.identityId().orElseThrow());
    }

    @Test
    @DisplayName("An auth record without profile should resolve as a full identity")
    void authRecordShouldResolveFull() {
        var id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO auth_users (id, email, created_at) VALUES (?, ?, ?)",
                id, "Ghost@Example.com", Timestamp.from(Instant.now()));

        var byId = resolver.resolve(null, id);
        var byEmail = resolver.resolve("ghost@example.com", null);

        assertEquals(IdentityKind.FULL, byId.kind());
        assertEquals("ghost@example.com", byId.email());
        assertEquals(IdentityKind.FULL, byEmail.kind());
        assertEquals(id, byEmail.identityId().orElseThrow());
    }

    @Test
    @DisplayName("Rows still keyed by an identity id should resolve as a full identity")
    void identityKeyedLeftoversShouldResolveFull() {
        var id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO user_notifications (user_id, message) VALUES (?, 'hello')", id);

        var resolved = resolver.resolve(id.toString());

        assertEquals(IdentityKind.FULL, resolved.kind());
        assertEquals(id, resolved.identityId().orElseThrow());
        assertNull(resolved.email());
        assertTrue(resolver.findProfile(id).isEmpty());
    }

    @Test
    @DisplayName("E-mail keyed data without profile should resolve as a partial identity")
    void emailKeyedDataShouldResolvePartial() {
        jdbcTemplate.update("INSERT INTO funnel_responses (user_email, answers) VALUES ('Guest@Example.com', '{}')");

        var resolved = resolver.resolve("guest@example.com");

        assertEquals(IdentityKind.PARTIAL, resolved.kind());
        assertTrue(resolved.identityId().isEmpty());
        assertEquals("guest@example.com", resolved.email());
    }

    @Test
    @DisplayName("A listing under the e-mail should resolve as a partial identity")
    void listingShouldResolvePartial() {
        entityManager.persistAndFlush(BusinessListing.builder()
                .id(UUID.randomUUID())
                .name("Corner Shop")
                .email("shop@example.com")
                .build());

        assertEquals(IdentityKind.PARTIAL, resolver.resolve("shop@example.com").kind());
    }

    @Test
    @DisplayName("Unknown input should resolve to nothing")
    void unknownShouldResolveNone() {
        assertTrue(resolver.resolve("nobody@example.com").isNone());
        assertTrue(resolver.resolve(UUID.randomUUID().toString()).isNone());
        assertTrue(resolver.resolve("not-an-id").isNone());
    }

    @Test
    @DisplayName("Should only parse identity ids from non e-mail input")
    void shouldParseIdentityIds() {
        var id = UUID.randomUUID();

        assertEquals(id, IdentityResolver.parseIdentityId(" " + id + " ").orElseThrow());
        assertTrue(IdentityResolver.parseIdentityId("amy@example.com").isEmpty());
        assertTrue(IdentityResolver.parseIdentityId("12345").isEmpty());
        assertTrue(IdentityResolver.parseIdentityId(null).isEmpty());
    }
}
