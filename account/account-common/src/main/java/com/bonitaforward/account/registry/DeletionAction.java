/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.registry;

public enum DeletionAction {
    /** Remove matching rows permanently */
    HARD_DELETE,
    /** Keep the row, clear its owner and mark it unlinked (unless a hard delete is requested) */
    SOFT_DELETE_OWNERSHIP
}
