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
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit trail entry written once per account deletion request.
 */
@Entity
@Table(name = "account_deletion_audit")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_identity_id")
    private UUID targetIdentityId;

    @Column(name = "target_email", length = 320)
    private String targetEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "identity_kind", nullable = false, length = 10)
    private IdentityKind identityKind;

    @Column(name = "requested_by", length = 320)
    private String requestedBy;

    @Column(name = "hard_delete_owned", nullable = false)
    private boolean hardDeleteOwned;

    @Column(name = "owned_hard_deleted", nullable = false)
    private int ownedHardDeleted;

    @Column(name = "owned_soft_deleted", nullable = false)
    private int ownedSoftDeleted;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @Column(name = "auth_record_removed", nullable = false)
    private boolean authRecordRemoved;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
