/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.registry;

/**
 * Cascade phases in execution order. Rows that reference other registered rows
 * go first, the profile goes last. The auth record is removed after every phase.
 */
public enum CascadePhase {
    DEPENDENT,
    EMAIL_KEYED,
    OWNED_ENTITY,
    PROFILE
}
