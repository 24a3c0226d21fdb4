/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

public record OwnedEntityDisposition(int hardDeleted, int softDeleted) {

    public static OwnedEntityDisposition none() {
        return new OwnedEntityDisposition(0, 0);
    }
}
