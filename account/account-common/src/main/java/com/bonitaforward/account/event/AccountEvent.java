/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Payload handed to the notification dispatcher.
 *
 * @param attributes event specific details, e.g. the write source or disposition counts
 */
public record AccountEvent(
        AccountEventType type,
        UUID identityId,
        String email,
        Map<String, Object> attributes,
        Instant occurredAt
) {

    public static AccountEvent of(AccountEventType type, UUID identityId, String email,
                                  Map<String, Object> attributes) {
        return new AccountEvent(type, identityId, email, Map.copyOf(attributes), Instant.now());
    }
}
