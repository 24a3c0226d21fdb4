/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.event.AccountEvent;
import com.bonitaforward.account.event.AccountEventPublisher;
import com.bonitaforward.account.event.AccountEventType;
import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.bonitaforward.account.model.EmailAddresses;
import com.bonitaforward.account.model.ProfileFields;
import com.bonitaforward.account.model.ProfileUpsertRequest;
import com.bonitaforward.account.repository.ProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates or merges a profile row.
 *
 * <p>A missing row is inserted with exactly the supplied fields. An existing row is merged
 * field by field: supplied values are written, absent values are preserved, and immutable
 * fields that already hold a value are left alone. Only changed columns are updated, so
 * repeating a request leaves the row untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileUpsertService {

    private final ProfileRepository profileRepository;
    private final IdentityResolver identityResolver;
    private final AccountEventPublisher eventPublisher;

    public AccountResult<Profile> upsert(UUID identityId, String email, ProfileFields fields) {
        return upsert(ProfileUpsertRequest.of(identityId, email, fields));
    }

    public AccountResult<Profile> upsert(ProfileUpsertRequest request) {
        if (request.identityId() == null) {
            return AccountResult.failure(AccountError.validation("identityId is required"));
        }
        String email = EmailAddresses.normalize(request.email());
        if (email == null) {
            return AccountResult.failure(AccountError.validation("email is required"));
        }

        log.info("Upserting profile {} from {}", request.identityId(), request.source());

        Profile saved;
        try {
            Optional<Profile> existing = identityResolver.findProfile(request.identityId());
            saved = existing.isPresent()
                    ? merge(existing.get(), email, request)
                    : insert(email, request);
        } catch (DataAccessException e) {
            log.error("Profile upsert for {} from {} failed", request.identityId(), request.source(), e);
            return AccountResult.failure(AccountError.persistence("Profile upsert", e));
        }

        warnIfIncomplete(saved, request);
        eventPublisher.publish(AccountEvent.of(AccountEventType.PROFILE_UPDATED, saved.getId(), saved.getEmail(),
                Map.of("source", request.source().name())));
        return AccountResult.success(saved);
    }

    private Profile insert(String email, ProfileUpsertRequest request) {
        Profile profile = Profile.builder()
                .id(request.identityId())
                .email(email)
                .build();
        for (ProfileField field : ProfileField.values()) {
            field.apply(request.fields(), profile);
        }

        Profile saved = profileRepository.saveAndFlush(profile);
        log.info("Created profile {} (role={})", saved.getId(), saved.getRole());
        return saved;
    }

    private Profile merge(Profile existing, String email, ProfileUpsertRequest request) {
        List<ProfileField> written = new ArrayList<>();
        boolean emailChanged = !Objects.equals(email, existing.getEmail());

        for (ProfileField field : ProfileField.values()) {
            switch (field.decide(request.fields(), existing)) {
                case WRITE -> {
                    field.apply(request.fields(), existing);
                    written.add(field);
                }
                case IMMUTABLE_CONFLICT -> log.info(
                        "Profile {} from {}: {} already set to {}, ignoring attempted value {}",
                        existing.getId(), request.source(), field, field.storedValue(existing),
                        field.incomingValue(request.fields()));
                case PRESERVED -> log.debug("Profile {}: preserving {} (not supplied)", existing.getId(), field);
                case UNCHANGED -> {
                    // nothing to write
                }
            }
        }
        if (emailChanged) {
            existing.setEmail(email);
        }

        if (written.isEmpty() && !emailChanged) {
            log.debug("Profile {} unchanged, skipping update", existing.getId());
            return existing;
        }

        Profile saved = profileRepository.saveAndFlush(existing);
        log.info("Updated profile {}: fields={}, emailChanged={}", saved.getId(), written, emailChanged);
        return saved;
    }

    private void warnIfIncomplete(Profile profile, ProfileUpsertRequest request) {
        boolean hasName = profile.getName() != null && !profile.getName().isBlank();
        boolean hasRole = profile.getRole() != null;
        if (!hasName || !hasRole) {
            log.warn("Profile {} incomplete after write from {}: hasName={}, hasRole={}",
                    profile.getId(), request.source(), hasName, hasRole);
        }
    }
}
