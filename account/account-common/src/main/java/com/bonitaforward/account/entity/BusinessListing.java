/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A business listing ("provider") that may be owned by an identity.
 *
 * <p>Ownership moves between three states: owned by an identity, unlinked (no owner,
 * reclaimable by e-mail on the next login), and hard deleted (row gone). An unlinked
 * listing never carries an owner: {@link com.bonitaforward.account.repository.BusinessListingRepository#unlinkById}
 * clears both in one statement.
 */
@Entity
@Table(name = "providers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessListing {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(length = 320)
    private String email;

    @Column(name = "owner_user_id")
    private UUID ownerIdentityId;

    @Builder.Default
    @Column(nullable = false)
    private boolean unlinked = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Reattach an unlinked listing to a newly authenticated identity.
     */
    public void relinkTo(UUID identityId) {
        Objects.requireNonNull(identityId, "identityId must not be null");
        if (!unlinked) {
            throw new IllegalStateException("Listing " + id + " is not unlinked");
        }
        this.ownerIdentityId = identityId;
        this.unlinked = false;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
