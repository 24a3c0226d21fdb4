/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import java.util.Locale;

/**
 * E-mail handling shared by every lookup: addresses are compared trimmed and lower-cased.
 */
public final class EmailAddresses {

    private EmailAddresses() {
    }

    /**
     * Returns the normalized form, or null for a null or blank address.
     */
    public static String normalize(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean looksLikeEmail(String value) {
        return value != null && value.indexOf('@') > 0;
    }
}
