/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.entity.BusinessListing;
import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.bonitaforward.account.model.EmailAddresses;
import com.bonitaforward.account.repository.BusinessListingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Runs after every successful login: listings left unlinked by an earlier soft delete are
 * handed to the identity that now authenticates with the same e-mail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnershipReconciliationService {

    private final BusinessListingRepository businessListingRepository;

    /**
     * @return the listings that were reattached, empty when there was nothing to reclaim
     */
    public AccountResult<List<BusinessListing>> reconcile(UUID identityId, String email) {
        if (identityId == null) {
            return AccountResult.failure(AccountError.validation("identityId is required"));
        }
        String normalizedEmail = EmailAddresses.normalize(email);
        if (normalizedEmail == null) {
            return AccountResult.failure(AccountError.validation("email is required"));
        }

        try {
            return AccountResult.success(relinkUnlinkedListings(identityId, normalizedEmail));
        } catch (DataAccessException e) {
            log.error("Ownership reconciliation for {} failed", identityId, e);
            return AccountResult.failure(AccountError.persistence("Ownership reconciliation", e));
        }
    }

    private List<BusinessListing> relinkUnlinkedListings(UUID identityId, String normalizedEmail) {
        List<BusinessListing> unlinked = businessListingRepository.findUnlinkedByNormalizedEmail(normalizedEmail);
        if (unlinked.isEmpty()) {
            log.debug("No unlinked listings for {}", identityId);
            return List.of();
        }

        unlinked.forEach(listing -> listing.relinkTo(identityId));
        List<BusinessListing> saved = businessListingRepository.saveAll(unlinked);
        log.info("Reattached {} listing(s) to {}: {}", saved.size(), identityId,
                saved.stream().map(BusinessListing::getId).toList());
        return saved;
    }
}
