/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import com.bonitaforward.account.entity.AccountRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A partial profile. A null field means "not supplied" and never clears a stored value.
 */
@Value
@Builder(toBuilder = true)
public class ProfileFields {

    String name;
    AccountRole role;
    Boolean residentVerified;
    String residentVerificationMethod;
    String residentZipCode;
    Instant residentVerifiedAt;
    Boolean emailNotificationsEnabled;
    Boolean marketingEmailsEnabled;

    public static ProfileFields empty() {
        return ProfileFields.builder().build();
    }
}
