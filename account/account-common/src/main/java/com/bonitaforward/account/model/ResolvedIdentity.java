/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import com.bonitaforward.account.entity.IdentityKind;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of identity resolution. The e-mail is always normalized; the identity id is
 * only present for {@link IdentityKind#FULL}.
 */
public record ResolvedIdentity(IdentityKind kind, Optional<UUID> identityId, String email) {

    public ResolvedIdentity {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(identityId, "identityId optional must not be null");
    }

    public static ResolvedIdentity full(UUID identityId, String email) {
        return new ResolvedIdentity(IdentityKind.FULL, Optional.of(identityId), email);
    }

    public static ResolvedIdentity partial(String email) {
        return new ResolvedIdentity(IdentityKind.PARTIAL, Optional.empty(), email);
    }

    public static ResolvedIdentity none(String email) {
        return new ResolvedIdentity(IdentityKind.NONE, Optional.empty(), email);
    }

    public boolean isFull() {
        return kind == IdentityKind.FULL;
    }

    public boolean isNone() {
        return kind == IdentityKind.NONE;
    }
}
