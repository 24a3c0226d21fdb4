/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.entity;

/**
 * What the resolver found for an e-mail / identity id.
 */
public enum IdentityKind {
    /** A profile (and normally an auth record) exists */
    FULL,
    /** Only e-mail keyed records or listings exist, no profile or auth record */
    PARTIAL,
    /** Nothing references the identity */
    NONE
}
