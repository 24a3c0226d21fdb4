/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DeletionOptionsTest {

    @Test
    @DisplayName("Soft delete should never hard delete a listing")
    void softDeleteShouldKeepListings() {
        var options = DeletionOptions.softDelete();

        assertFalse(options.shouldHardDelete(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Hard delete without a selection should cover every listing")
    void hardDeleteShouldCoverAllListings() {
        var options = DeletionOptions.hardDelete();

        assertTrue(options.shouldHardDelete(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Hard delete with a selection should only cover the selected listings")
    void selectiveHardDelete() {
        var selected = UUID.randomUUID();
        var options = DeletionOptions.builder()
                .hardDeleteOwnedEntities(true)
                .ownedEntityIdToHardDelete(selected)
                .build();

        assertTrue(options.shouldHardDelete(selected));
        assertFalse(options.shouldHardDelete(UUID.randomUUID()));
    }

    @Test
    @DisplayName("A selection without the hard delete flag should be ignored")
    void selectionWithoutFlagIsIgnored() {
        var selected = UUID.randomUUID();
        var options = DeletionOptions.builder()
                .ownedEntityIdToHardDelete(selected)
                .build();

        assertFalse(options.shouldHardDelete(selected));
    }
}
