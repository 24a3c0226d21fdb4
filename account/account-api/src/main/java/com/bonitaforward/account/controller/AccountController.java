/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.controller;

import com.bonitaforward.account.dto.AccountResponse;
import com.bonitaforward.account.dto.DeleteAccountResponse;
import com.bonitaforward.account.dto.ProfileUpsertBody;
import com.bonitaforward.account.dto.ReconcileBody;
import com.bonitaforward.account.entity.BusinessListing;
import com.bonitaforward.account.entity.Profile;
import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.bonitaforward.account.model.DeletionOptions;
import com.bonitaforward.account.model.DeletionReport;
import com.bonitaforward.account.model.ResolvedIdentity;
import com.bonitaforward.account.service.AccountDeletionService;
import com.bonitaforward.account.service.IdentityResolver;
import com.bonitaforward.account.service.OwnershipReconciliationService;
import com.bonitaforward.account.service.ProfileUpsertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final ProfileUpsertService profileUpsertService;
    private final AccountDeletionService accountDeletionService;
    private final OwnershipReconciliationService ownershipReconciliationService;
    private final IdentityResolver identityResolver;

    @PutMapping("/{identityId}/profile")
    public ResponseEntity<AccountResponse<Profile>> upsertProfile(
            @PathVariable UUID identityId,
            @RequestBody ProfileUpsertBody body) {
        AccountResult<Profile> result = profileUpsertService.upsert(body.toRequest(identityId));
        return respond(result);
    }

    @DeleteMapping("/{identityOrEmail}")
    public ResponseEntity<DeleteAccountResponse> deleteAccount(
            @PathVariable String identityOrEmail,
            @RequestParam(value = "hardDeleteOwnedEntities", defaultValue = "false") boolean hardDeleteOwnedEntities,
            @RequestParam(value = "ownedEntityIds", required = false) List<UUID> ownedEntityIds,
            @RequestHeader(value = "X-Requested-By", required = false) String requestedBy) {
        DeletionOptions.DeletionOptionsBuilder options = DeletionOptions.builder()
                .hardDeleteOwnedEntities(hardDeleteOwnedEntities)
                .requestedBy(requestedBy);
        if (ownedEntityIds != null) {
            options.ownedEntityIdsToHardDelete(ownedEntityIds);
        }

        log.info("Account deletion requested for {} by {} (hardDeleteOwnedEntities={})",
                identityOrEmail, requestedBy, hardDeleteOwnedEntities);
        AccountResult<DeletionReport> result = accountDeletionService.deleteAccount(identityOrEmail, options.build());

        DeleteAccountResponse response = DeleteAccountResponse.from(result);
        if (response.getError() == null) {
            return ResponseEntity.ok(response);
        }
        log.warn("Deletion of {} ended with {}: {}", identityOrEmail,
                response.getError().kind(), response.getError().message());
        return ResponseEntity.status(statusFor(response.getError())).body(response);
    }

    @PostMapping("/{identityId}/reconcile")
    public ResponseEntity<AccountResponse<List<BusinessListing>>> reconcile(
            @PathVariable UUID identityId,
            @RequestBody ReconcileBody body) {
        return respond(ownershipReconciliationService.reconcile(identityId, body.getEmail()));
    }

    @GetMapping("/resolve")
    public ResponseEntity<AccountResponse<ResolvedIdentity>> resolve(
            @RequestParam(value = "email", required = false) String email,
            @RequestParam(value = "identityId", required = false) UUID identityId) {
        if (identityId == null && (email == null || email.isBlank())) {
            return respond(AccountResult.failure(AccountError.validation("email or identityId is required")));
        }
        try {
            return respond(AccountResult.success(identityResolver.resolve(email, identityId)));
        } catch (DataAccessException e) {
            log.error("Identity resolution failed for email={}, identityId={}", email, identityId, e);
            return respond(AccountResult.failure(AccountError.persistence("Identity resolution", e)));
        }
    }

    private <T> ResponseEntity<AccountResponse<T>> respond(AccountResult<T> result) {
        return result
                .onFailure(error -> log.warn("Request failed with {}: {}", error.kind(), error.message()))
                .map(data -> ResponseEntity.ok(AccountResponse.success(data)))
                .orElseGet(error -> ResponseEntity.status(statusFor(error)).body(AccountResponse.<T>failure(error)));
    }

    static HttpStatus statusFor(AccountError error) {
        return switch (error.kind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PARTIAL_FAILURE -> HttpStatus.MULTI_STATUS;
            case PERSISTENCE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
