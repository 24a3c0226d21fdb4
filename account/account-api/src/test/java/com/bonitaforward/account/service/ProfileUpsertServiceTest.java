/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.config.AccountProperties;
import com.bonitaforward.account.entity.AccountRole;
import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.event.AccountEvent;
import com.bonitaforward.account.event.AccountEventPublisher;
import com.bonitaforward.account.event.AccountEventType;
import com.bonitaforward.account.model.ErrorKind;
import com.bonitaforward.account.model.ProfileFields;
import com.bonitaforward.account.model.ProfileUpdateSource;
import com.bonitaforward.account.model.ProfileUpsertRequest;
import com.bonitaforward.account.registry.DeletionRegistry;
import com.bonitaforward.account.repository.JdbcAuthRecordStore;
import com.bonitaforward.account.repository.ProfileRepository;
import com.bonitaforward.account.repository.RegistryJdbcRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Profile upsert against the migrated schema.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({ProfileUpsertService.class, IdentityResolver.class, DeletionRegistry.class,
        RegistryJdbcRepository.class, JdbcAuthRecordStore.class, AccountProperties.class})
class ProfileUpsertServiceTest {

    @Autowired
    private ProfileUpsertService service;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private TestEntityManager entityManager;

    @MockBean
    private AccountEventPublisher eventPublisher;

    private Profile reload(UUID id) {
        entityManager.flush();
        entityManager.clear();
        return profileRepository.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("Should insert a new profile with exactly the supplied fields")
    void shouldInsertNewProfile() {
        var id = UUID.randomUUID();

        var result = service.upsert(new ProfileUpsertRequest(id, " Amy@Example.com ",
                ProfileFields.builder().name("Amy").role(AccountRole.BUSINESS).build(),
                ProfileUpdateSource.SIGNUP));

        assertTrue(result.isSuccess());
        var stored = reload(id);
        assertEquals("amy@example.com", stored.getEmail());
        assertEquals("Amy", stored.getName());
        assertEquals(AccountRole.BUSINESS, stored.getRole());
        assertNull(stored.getResidentVerified());
        assertNull(stored.getMarketingEmailsEnabled());
        assertNotNull(stored.getCreatedAt());
        verify(eventPublisher).publish(argThat((AccountEvent event) ->
                event.type() == AccountEventType.PROFILE_UPDATED
                        && id.equals(event.identityId())
                        && "SIGNUP".equals(event.attributes().get("source"))));
    }

    @Test
    @DisplayName("Should preserve stored values for fields that are not supplied")
    void shouldPreserveAbsentFields() {
        var id = UUID.randomUUID();
        var verifiedAt = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        service.upsert(id, "amy@example.com", ProfileFields.builder()
                .name("Amy")
                .residentVerified(true)
                .residentVerificationMethod("utility_bill")
                .residentZipCode("34135")
                .residentVerifiedAt(verifiedAt)
                .build());

        var result = service.upsert(id, "amy@example.com", ProfileFields.builder()
                .marketingEmailsEnabled(false)
                .build());

        assertTrue(result.isSuccess());
        var stored = reload(id);
        assertEquals("Amy", stored.getName());
        assertEquals(Boolean.TRUE, stored.getResidentVerified());
        assertEquals("utility_bill", stored.getResidentVerificationMethod());
        assertEquals("34135", stored.getResidentZipCode());
        assertEquals(verifiedAt, stored.getResidentVerifiedAt());
        assertEquals(Boolean.FALSE, stored.getMarketingEmailsEnabled());
    }

    @Test
    @DisplayName("A business signup should survive a later auth sync that defaults to community")
    void roleShouldSurviveLaterSync() {
        var id = UUID.randomUUID();
        service.upsert(new ProfileUpsertRequest(id, "amy@example.com",
                ProfileFields.builder().name("Amy's Bakery").role(AccountRole.BUSINESS).build(),
                ProfileUpdateSource.SIGNUP));

        var result = service.upsert(new ProfileUpsertRequest(id, "amy@example.com",
                ProfileFields.builder().role(AccountRole.COMMUNITY).build(),
                ProfileUpdateSource.AUTH_CONTEXT));

        assertTrue(result.isSuccess());
        var stored = reload(id);
        assertEquals(AccountRole.BUSINESS, stored.getRole());
        assertEquals("Amy's Bakery", stored.getName());
    }

    @Test
    @DisplayName("A role may still be set while the stored value is empty")
    void roleShouldBeWritableWhileEmpty() {
        var id = UUID.randomUUID();
        service.upsert(id, "amy@example.com", ProfileFields.builder().name("Amy").build());

        service.upsert(id, "amy@example.com", ProfileFields.builder().role(AccountRole.COMMUNITY).build());

        assertEquals(AccountRole.COMMUNITY, reload(id).getRole());
    }

    @Test
    @DisplayName("Repeating the same request should leave the row unchanged")
    void repeatedRequestShouldBeIdempotent() {
        var id = UUID.randomUUID();
        var fields = ProfileFields.builder()
                .name("Amy")
                .role(AccountRole.COMMUNITY)
                .emailNotificationsEnabled(true)
                .build();
        service.upsert(id, "amy@example.com", fields);
        var first = reload(id);

        var result = service.upsert(id, "AMY@example.com", fields);

        assertTrue(result.isSuccess());
        var second = reload(id);
        assertEquals(first.getUpdatedAt(), second.getUpdatedAt());
        assertEquals(first.getName(), second.getName());
        assertEquals(first.getRole(), second.getRole());
        assertEquals(first.getEmailNotificationsEnabled(), second.getEmailNotificationsEnabled());
        assertEquals(1, profileRepository.count());
    }

    @Test
    @DisplayName("Should update the stored e-mail when it changes")
    void shouldUpdateChangedEmail() {
        var id = UUID.randomUUID();
        service.upsert(id, "amy@example.com", ProfileFields.builder().name("Amy").build());

        service.upsert(id, "amy.new@example.com", ProfileFields.empty());

        var stored = reload(id);
        assertEquals("amy.new@example.com", stored.getEmail());
        assertEquals("Amy", stored.getName());
    }

    @Test
    @DisplayName("Should reject a request without identity id")
    void shouldRejectMissingIdentity() {
        var result = service.upsert(null, "amy@example.com", ProfileFields.empty());

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.VALIDATION, result.getError().kind());
        verify(eventPublisher, never()).publish(any());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("Should reject a request without e-mail")
    void shouldRejectMissingEmail(String email) {
        var result = service.upsert(UUID.randomUUID(), email, ProfileFields.builder().name("Amy").build());

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.VALIDATION, result.getError().kind());
        assertEquals(0, profileRepository.count());
    }

    @Test
    @DisplayName("Should default the write source to account settings")
    void shouldDefaultSource() {
        var request = ProfileUpsertRequest.of(UUID.randomUUID(), "amy@example.com", null);

        assertEquals(ProfileUpdateSource.ACCOUNT_SETTINGS, request.source());
        assertNotNull(request.fields());
    }
}
