/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import java.util.UUID;

/**
 * Everything a profile write needs, passed in one piece by the caller.
 */
public record ProfileUpsertRequest(
        UUID identityId,
        String email,
        ProfileFields fields,
        ProfileUpdateSource source
) {

    public ProfileUpsertRequest {
        if (fields == null) {
            fields = ProfileFields.empty();
        }
        if (source == null) {
            source = ProfileUpdateSource.ACCOUNT_SETTINGS;
        }
    }

    public static ProfileUpsertRequest of(UUID identityId, String email, ProfileFields fields) {
        return new ProfileUpsertRequest(identityId, email, fields, null);
    }
}
