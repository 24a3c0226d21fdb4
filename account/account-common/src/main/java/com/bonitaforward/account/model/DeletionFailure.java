/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

/**
 * A cascade step that did not complete. Operators use the table and reason to finish cleanup by hand.
 */
public record DeletionFailure(String table, String reason) {
}
