/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.UUID;

/**
 * What to do with owned business listings during account deletion, and who asked.
 */
@Value
@Builder
public class DeletionOptions {

    /** Remove owned listings permanently instead of unlinking them */
    boolean hardDeleteOwnedEntities;

    /**
     * When non-empty and {@link #hardDeleteOwnedEntities} is set, only these listings are
     * removed; every other owned listing is unlinked.
     */
    @Singular("ownedEntityIdToHardDelete")
    Set<UUID> ownedEntityIdsToHardDelete;

    /** Actor that requested the deletion, for the audit trail; null for self-deletion */
    String requestedBy;

    public static DeletionOptions softDelete() {
        return DeletionOptions.builder().hardDeleteOwnedEntities(false).build();
    }

    public static DeletionOptions hardDelete() {
        return DeletionOptions.builder().hardDeleteOwnedEntities(true).build();
    }

    public boolean shouldHardDelete(UUID listingId) {
        if (!hardDeleteOwnedEntities) {
            return false;
        }
        return ownedEntityIdsToHardDelete.isEmpty() || ownedEntityIdsToHardDelete.contains(listingId);
    }
}
