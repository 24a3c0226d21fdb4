/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

/**
 * Failure categories shared by every account lifecycle operation.
 */
public enum ErrorKind {
    /** Required identity or e-mail missing; nothing was touched */
    VALIDATION,
    /** Nothing references the requested identity */
    NOT_FOUND,
    /** One or more cascade steps failed; the remaining steps still ran */
    PARTIAL_FAILURE,
    /** Storage unavailable or rejected the statement */
    PERSISTENCE
}
