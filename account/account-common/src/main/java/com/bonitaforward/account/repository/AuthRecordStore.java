/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Access to the identity provider's backing user records.
 */
public interface AuthRecordStore {

    enum Removal {
        REMOVED,
        ALREADY_ABSENT
    }

    boolean exists(UUID identityId);

    Optional<UUID> findIdentityIdByEmail(String normalizedEmail);

    Optional<String> findEmail(UUID identityId);

    /**
     * Removes the auth record. Removing a record that is already gone is not an error.
     */
    Removal remove(UUID identityId);
}
