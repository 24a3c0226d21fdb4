/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.model.EmailAddresses;
import com.bonitaforward.account.model.ResolvedIdentity;
import com.bonitaforward.account.registry.DeletionRegistry;
import com.bonitaforward.account.registry.DeletionTarget;
import com.bonitaforward.account.registry.KeyType;
import com.bonitaforward.account.repository.AuthRecordStore;
import com.bonitaforward.account.repository.BusinessListingRepository;
import com.bonitaforward.account.repository.ProfileRepository;
import com.bonitaforward.account.repository.RegistryJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether an e-mail / identity id refers to a full account, to stray e-mail keyed
 * data only, or to nothing. Read only.
 *
 * <p>An identity id that still keys rows in any registered table resolves {@code FULL} even
 * without a profile or auth record, so a deletion retried by id can finish its cleanup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final ProfileRepository profileRepository;
    private final AuthRecordStore authRecordStore;
    private final BusinessListingRepository businessListingRepository;
    private final RegistryJdbcRepository registryJdbcRepository;
    private final DeletionRegistry deletionRegistry;

    /**
     * Resolves an identity. Profile existence is checked before any e-mail keyed data,
     * so an identity with a profile is always {@code FULL}.
     *
     * @param email      e-mail address, may be null when an identity id is given
     * @param identityId identity id, may be null
     */
    public ResolvedIdentity resolve(String email, UUID identityId) {
        String normalizedEmail = EmailAddresses.normalize(email);
        log.debug("Resolving identity: email={}, identityId={}", normalizedEmail, identityId);

        Optional<Profile> profile = identityId != null
                ? findProfile(identityId)
                : Optional.ofNullable(normalizedEmail).flatMap(profileRepository::findByNormalizedEmail);
        if (profile.isPresent()) {
            String profileEmail = EmailAddresses.normalize(profile.get().getEmail());
            return ResolvedIdentity.full(profile.get().getId(),
                    profileEmail != null ? profileEmail : normalizedEmail);
        }

        // An auth record without a profile is still an account that must be removed
        Optional<UUID> authIdentity = identityId != null
                ? (authRecordStore.exists(identityId) ? Optional.of(identityId) : Optional.empty())
                : Optional.ofNullable(normalizedEmail).flatMap(authRecordStore::findIdentityIdByEmail);
        if (authIdentity.isPresent()) {
            String authEmail = normalizedEmail != null ? normalizedEmail
                    : authRecordStore.findEmail(authIdentity.get()).map(EmailAddresses::normalize).orElse(null);
            return ResolvedIdentity.full(authIdentity.get(), authEmail);
        }

        // Rows left behind by a deletion whose step failed after the profile was already gone
        if (identityId != null && hasIdentityKeyedData(identityId)) {
            log.info("Identity {} has no profile or auth record but still owns rows", identityId);
            return ResolvedIdentity.full(identityId, normalizedEmail);
        }

        if (normalizedEmail != null && hasEmailKeyedData(normalizedEmail)) {
            return ResolvedIdentity.partial(normalizedEmail);
        }

        log.debug("Nothing found for email={}, identityId={}", normalizedEmail, identityId);
        return ResolvedIdentity.none(normalizedEmail);
    }

    /**
     * Resolves a single value that is either an identity id (UUID form) or an e-mail.
     */
    public ResolvedIdentity resolve(String identityOrEmail) {
        Optional<UUID> identityId = parseIdentityId(identityOrEmail);
        return identityId.isPresent()
                ? resolve(null, identityId.get())
                : resolve(identityOrEmail, null);
    }

    /**
     * The stored profile for an identity id. This is the first check {@link #resolve} makes,
     * exposed for callers that need the row itself.
     */
    public Optional<Profile> findProfile(UUID identityId) {
        return profileRepository.findById(identityId);
    }

    static Optional<UUID> parseIdentityId(String value) {
        if (value == null || EmailAddresses.looksLikeEmail(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private boolean hasIdentityKeyedData(UUID identityId) {
        for (DeletionTarget target : deletionRegistry.fullCascade()) {
            if (target.getKeyType() == KeyType.BY_ID
                    && registryJdbcRepository.countByIdentity(target, identityId) > 0) {
                return true;
            }
        }
        return false;
    }

    private boolean hasEmailKeyedData(String normalizedEmail) {
        for (DeletionTarget target : deletionRegistry.emailCascade()) {
            if (target.getKeyType() == KeyType.BY_EMAIL
                    && registryJdbcRepository.countByEmail(target, normalizedEmail) > 0) {
                return true;
            }
        }
        return businessListingRepository.countByNormalizedEmail(normalizedEmail) > 0;
    }
}
