/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered views over {@link DeletionTarget} used by the deletion cascade and the schema check.
 */
@Slf4j
@Component
public class DeletionRegistry {

    private final List<DeletionTarget> fullCascade;
    private final List<DeletionTarget> emailCascade;

    public DeletionRegistry() {
        this.fullCascade = Arrays.stream(DeletionTarget.values())
                .sorted(Comparator.comparing(DeletionTarget::getPhase))
                .toList();
        this.emailCascade = fullCascade.stream()
                .filter(DeletionTarget::isMatchableByEmail)
                .toList();
        log.info("Registered {} deletion targets ({} matchable by e-mail)",
                fullCascade.size(), emailCascade.size());
    }

    /**
     * Every target, in cascade order. Used when a profile or auth record exists.
     */
    public List<DeletionTarget> fullCascade() {
        return fullCascade;
    }

    /**
     * Targets reachable from an e-mail alone. Used for identities without a profile.
     */
    public List<DeletionTarget> emailCascade() {
        return emailCascade;
    }
}
