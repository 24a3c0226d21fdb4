/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.dto;

import com.bonitaforward.account.entity.AccountRole;
import com.bonitaforward.account.model.ProfileFields;
import com.bonitaforward.account.model.ProfileUpdateSource;
import com.bonitaforward.account.model.ProfileUpsertRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpsertBody {
    private String email;
    private String name;
    private AccountRole role;
    private Boolean residentVerified;
    private String residentVerificationMethod;
    private String residentZipCode;
    private Instant residentVerifiedAt;
    private Boolean emailNotificationsEnabled;
    private Boolean marketingEmailsEnabled;
    private ProfileUpdateSource source;

    public ProfileUpsertRequest toRequest(UUID identityId) {
        ProfileFields fields = ProfileFields.builder()
                .name(name)
                .role(role)
                .residentVerified(residentVerified)
                .residentVerificationMethod(residentVerificationMethod)
                .residentZipCode(residentZipCode)
                .residentVerifiedAt(residentVerifiedAt)
                .emailNotificationsEnabled(emailNotificationsEnabled)
                .marketingEmailsEnabled(marketingEmailsEnabled)
                .build();
        return new ProfileUpsertRequest(identityId, email, fields, source);
    }
}
