/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

/**
 * Caller tag for profile writes. Only used in logs and events, never changes behavior.
 */
public enum ProfileUpdateSource {
    SIGNUP,
    ONBOARDING,
    ACCOUNT_SETTINGS,
    AUTH_CONTEXT,
    ADMIN_SYNC
}
