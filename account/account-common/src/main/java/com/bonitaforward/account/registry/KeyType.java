/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.registry;

/**
 * How rows in a registered table are tied to an identity.
 */
public enum KeyType {
    /** Column holds the identity id */
    BY_ID,
    /** Column holds an e-mail address, compared case-insensitively */
    BY_EMAIL
}
