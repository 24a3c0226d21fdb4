/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import com.bonitaforward.account.entity.IdentityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Itemized outcome of an account deletion. The cascade is not atomic: a report with
 * failures still reflects every step that did run.
 *
 * @param removedCounts rows removed per table, in cascade order
 */
public record DeletionReport(
        IdentityKind identityKind,
        UUID identityId,
        String email,
        Map<String, Integer> removedCounts,
        OwnedEntityDisposition ownedEntityDisposition,
        List<DeletionFailure> failures,
        boolean authRecordRemoved
) {

    public DeletionReport {
        removedCounts = Collections.unmodifiableMap(new LinkedHashMap<>(removedCounts));
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public int removedFrom(String table) {
        return removedCounts.getOrDefault(table, 0);
    }
}
