/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.dto;

import com.bonitaforward.account.entity.IdentityKind;
import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.bonitaforward.account.model.DeletionFailure;
import com.bonitaforward.account.model.DeletionReport;
import com.bonitaforward.account.model.OwnedEntityDisposition;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deletion outcome as returned to callers. {@code success} is false when any cascade step
 * failed; the error is then {@code PARTIAL_FAILURE} and the failure list tells operators
 * what is left to clean up.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeleteAccountResponse {
    boolean success;
    IdentityKind identityKind;
    UUID identityId;
    String email;
    Map<String, Integer> deletedCounts;
    OwnedEntityDisposition ownedEntityDisposition;
    List<DeletionFailure> failures;
    Boolean authRecordRemoved;
    AccountError error;

    public static DeleteAccountResponse from(AccountResult<DeletionReport> result) {
        return result.map(DeleteAccountResponse::fromReport)
                .orElseGet(error -> DeleteAccountResponse.builder()
                        .success(false)
                        .error(error)
                        .build());
    }

    private static DeleteAccountResponse fromReport(DeletionReport report) {
        return DeleteAccountResponse.builder()
                .success(report.isComplete())
                .identityKind(report.identityKind())
                .identityId(report.identityId())
                .email(report.email())
                .deletedCounts(report.removedCounts())
                .ownedEntityDisposition(report.ownedEntityDisposition())
                .failures(report.failures())
                .authRecordRemoved(report.authRecordRemoved())
                .error(report.isComplete() ? null : AccountError.partialFailure(report.failures().size()))
                .build();
    }
}
