/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.model.ProfileFields;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Mergeable profile columns. Immutable fields may be written while the stored value is
 * still null, never afterwards.
 */
enum ProfileField {

    NAME(false, ProfileFields::getName, Profile::getName, Profile::setName),
    ROLE(true, ProfileFields::getRole, Profile::getRole, Profile::setRole),
    RESIDENT_VERIFIED(false, ProfileFields::getResidentVerified,
            Profile::getResidentVerified, Profile::setResidentVerified),
    RESIDENT_VERIFICATION_METHOD(false, ProfileFields::getResidentVerificationMethod,
            Profile::getResidentVerificationMethod, Profile::setResidentVerificationMethod),
    RESIDENT_ZIP_CODE(false, ProfileFields::getResidentZipCode,
            Profile::getResidentZipCode, Profile::setResidentZipCode),
    RESIDENT_VERIFIED_AT(false, ProfileFields::getResidentVerifiedAt,
            Profile::getResidentVerifiedAt, Profile::setResidentVerifiedAt),
    EMAIL_NOTIFICATIONS_ENABLED(false, ProfileFields::getEmailNotificationsEnabled,
            Profile::getEmailNotificationsEnabled, Profile::setEmailNotificationsEnabled),
    MARKETING_EMAILS_ENABLED(false, ProfileFields::getMarketingEmailsEnabled,
            Profile::getMarketingEmailsEnabled, Profile::setMarketingEmailsEnabled);

    enum MergeDecision {
        WRITE,
        UNCHANGED,
        PRESERVED,
        IMMUTABLE_CONFLICT
    }

    private final boolean immutable;
    private final Function<ProfileFields, ?> incoming;
    private final Function<Profile, ?> stored;
    private final BiConsumer<ProfileFields, Profile> copier;

    <V> ProfileField(boolean immutable,
                     Function<ProfileFields, V> incoming,
                     Function<Profile, V> stored,
                     BiConsumer<Profile, V> writer) {
        this.immutable = immutable;
        this.incoming = incoming;
        this.stored = stored;
        this.copier = (fields, target) -> writer.accept(target, incoming.apply(fields));
    }

    boolean isImmutable() {
        return immutable;
    }

    Object incomingValue(ProfileFields fields) {
        return incoming.apply(fields);
    }

    Object storedValue(Profile profile) {
        return stored.apply(profile);
    }

    /**
     * Decides what happens to this column when {@code fields} is merged into {@code existing}.
     */
    MergeDecision decide(ProfileFields fields, Profile existing) {
        Object next = incomingValue(fields);
        Object current = storedValue(existing);
        if (next == null) {
            return preservedOrUnchanged(current);
        }
        if (Objects.equals(next, current)) {
            return MergeDecision.UNCHANGED;
        }
        if (immutable && current != null) {
            return MergeDecision.IMMUTABLE_CONFLICT;
        }
        return MergeDecision.WRITE;
    }

    /**
     * Copies the incoming value onto the profile. Callers only do this for {@link MergeDecision#WRITE}
     * or when building a new row.
     */
    void apply(ProfileFields fields, Profile target) {
        copier.accept(fields, target);
    }

    private static MergeDecision preservedOrUnchanged(Object current) {
        return current != null ? MergeDecision.PRESERVED : MergeDecision.UNCHANGED;
    }
}
