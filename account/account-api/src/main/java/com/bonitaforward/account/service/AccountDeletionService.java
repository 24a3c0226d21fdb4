/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.service;

import com.bonitaforward.account.config.AccountProperties;
import com.bonitaforward.account.entity.BusinessListing;
import com.bonitaforward.account.entity.DeletionAuditEntry;
import com.bonitaforward.account.event.AccountEvent;
import com.bonitaforward.account.event.AccountEventPublisher;
import com.bonitaforward.account.event.AccountEventType;
import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.bonitaforward.account.model.DeletionFailure;
import com.bonitaforward.account.model.DeletionOptions;
import com.bonitaforward.account.model.DeletionReport;
import com.bonitaforward.account.model.OwnedEntityDisposition;
import com.bonitaforward.account.model.ResolvedIdentity;
import com.bonitaforward.account.registry.DeletionAction;
import com.bonitaforward.account.registry.DeletionRegistry;
import com.bonitaforward.account.registry.DeletionTarget;
import com.bonitaforward.account.registry.KeyType;
import com.bonitaforward.account.repository.AuthRecordStore;
import com.bonitaforward.account.repository.BusinessListingRepository;
import com.bonitaforward.account.repository.DeletionAuditRepository;
import com.bonitaforward.account.repository.RegistryJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * Tears down an account and everything that references it, following {@link DeletionRegistry}.
 *
 * <p>Each step commits on its own. A failing step is recorded in the report and the cascade
 * carries on, so a retry only has the failed steps left to do. Deleting rows that are already
 * gone counts zero, and a missing auth record is not an error, which makes reruns safe.
 *
 * <p>Full accounts go through every registered table, then the auth record. Identities with
 * only e-mail keyed data go through the e-mail matchable tables and have no auth record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountDeletionService {

    static final String AUTH_RECORD_TABLE = "auth_users";

    private final IdentityResolver identityResolver;
    private final DeletionRegistry deletionRegistry;
    private final RegistryJdbcRepository registryJdbcRepository;
    private final BusinessListingRepository businessListingRepository;
    private final AuthRecordStore authRecordStore;
    private final DeletionAuditRepository deletionAuditRepository;
    private final AccountEventPublisher eventPublisher;
    private final AccountProperties properties;

    public AccountResult<DeletionReport> deleteAccount(String identityOrEmail, DeletionOptions options) {
        if (identityOrEmail == null || identityOrEmail.isBlank()) {
            return AccountResult.failure(AccountError.validation("identity id or email is required"));
        }
        DeletionOptions effectiveOptions = options != null ? options : DeletionOptions.softDelete();

        ResolvedIdentity identity;
        try {
            identity = identityResolver.resolve(identityOrEmail);
        } catch (DataAccessException e) {
            log.error("Could not resolve {} for deletion", identityOrEmail, e);
            return AccountResult.failure(AccountError.persistence("Identity resolution", e));
        }

        if (identity.isNone()) {
            log.info("Nothing to delete for {}", identityOrEmail);
            return AccountResult.failure(AccountError.notFound(identityOrEmail));
        }

        log.info("Deleting {} account {} (email={}, hardDeleteOwnedEntities={}, requestedBy={})",
                identity.kind(), identity.identityId().orElse(null), identity.email(),
                effectiveOptions.isHardDeleteOwnedEntities(), effectiveOptions.getRequestedBy());

        CascadeRun run = new CascadeRun(identity, effectiveOptions);
        if (identity.isFull()) {
            runFullCascade(run);
        } else {
            runEmailCascade(run);
        }

        DeletionReport report = run.toReport();
        writeAudit(report, effectiveOptions);
        publishDeleted(report);

        if (report.isComplete()) {
            log.info("Account {} deleted: removed={}, owned={}", describe(identity),
                    report.removedCounts(), report.ownedEntityDisposition());
        } else {
            log.warn("Account {} deleted with {} failed step(s): {}", describe(identity),
                    report.failures().size(), report.failures());
        }
        return AccountResult.success(report);
    }

    private void runFullCascade(CascadeRun run) {
        UUID identityId = run.identity.identityId().orElseThrow();
        String email = run.identity.email();

        for (DeletionTarget target : deletionRegistry.fullCascade()) {
            if (target.getAction() == DeletionAction.SOFT_DELETE_OWNERSHIP) {
                disposeOwnedListings(run, target, () -> ownedByIdentity(identityId, email, run.options));
            } else if (target.getKeyType() == KeyType.BY_ID) {
                runStep(run, target.getTable(), () -> registryJdbcRepository.deleteByIdentity(target, identityId));
            } else if (email != null) {
                runStep(run, target.getTable(), () -> registryJdbcRepository.deleteByEmail(target, email));
            } else {
                log.debug("No email known for {}, skipping {}", identityId, target.getTable());
            }
        }

        // Irreversible, so it goes after every other step has been attempted
        try {
            AuthRecordStore.Removal removal = authRecordStore.remove(identityId);
            run.authRecordRemoved = true;
            run.recordRemoved(AUTH_RECORD_TABLE, removal == AuthRecordStore.Removal.REMOVED ? 1 : 0);
            log.info("Auth record {} for {}", removal == AuthRecordStore.Removal.REMOVED
                    ? "removed" : "already absent", identityId);
        } catch (DataAccessException e) {
            log.error("Failed to remove auth record {}", identityId, e);
            run.recordFailure(AUTH_RECORD_TABLE, e);
        }
    }

    private void runEmailCascade(CascadeRun run) {
        String email = run.identity.email();
        for (DeletionTarget target : deletionRegistry.emailCascade()) {
            if (target.getAction() == DeletionAction.SOFT_DELETE_OWNERSHIP) {
                // Listings owned by someone else stay where they are
                disposeOwnedListings(run, target, () -> businessListingRepository.findUnownedByNormalizedEmail(email));
            } else {
                runStep(run, target.getTable(), () -> registryJdbcRepository.deleteByEmail(target, email));
            }
        }
    }

    /**
     * Listings owned by the identity, plus, when a hard delete is requested, listings left
     * unlinked under the same e-mail by an earlier soft delete.
     */
    private List<BusinessListing> ownedByIdentity(UUID identityId, String email, DeletionOptions options) {
        Map<UUID, BusinessListing> listings = new LinkedHashMap<>();
        businessListingRepository.findByOwnerIdentityId(identityId)
                .forEach(listing -> listings.put(listing.getId(), listing));
        if (options.isHardDeleteOwnedEntities() && email != null) {
            businessListingRepository.findUnlinkedByNormalizedEmail(email)
                    .forEach(listing -> listings.putIfAbsent(listing.getId(), listing));
        }
        return new ArrayList<>(listings.values());
    }

    private void disposeOwnedListings(CascadeRun run, DeletionTarget target, Supplier<List<BusinessListing>> candidates) {
        List<BusinessListing> listings;
        try {
            listings = candidates.get();
        } catch (DataAccessException e) {
            log.error("Could not load owned listings for {}", describe(run.identity), e);
            run.recordFailure(target.getTable(), e);
            return;
        }

        log.info("Found {} listing(s) to dispose for {}", listings.size(), describe(run.identity));
        int hardDeleted = 0;
        for (BusinessListing listing : listings) {
            if (run.options.shouldHardDelete(listing.getId())) {
                if (hardDeleteListing(run, target, listing)) {
                    hardDeleted++;
                    continue;
                }
                // Fall back to unlinking so the listing at least loses its owner
            }
            unlinkListing(run, target, listing);
        }
        run.recordRemoved(target.getTable(), hardDeleted);
    }

    private boolean hardDeleteListing(CascadeRun run, DeletionTarget target, BusinessListing listing) {
        try {
            businessListingRepository.hardDeleteById(listing.getId());
            if (properties.getDeletion().isVerifyHardDeletes()
                    && businessListingRepository.existsById(listing.getId())) {
                log.error("Listing {} ({}) still exists after hard delete", listing.getId(), listing.getName());
                run.failures.add(new DeletionFailure(target.getTable(),
                        "listing " + listing.getId() + " still exists after hard delete; unlinked instead"));
                return false;
            }
            run.hardDeleted++;
            log.info("Hard deleted listing {} ({})", listing.getId(), listing.getName());
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to hard delete listing {} ({})", listing.getId(), listing.getName(), e);
            run.failures.add(new DeletionFailure(target.getTable(),
                    "hard delete of listing " + listing.getId() + " failed: " + reason(e) + "; unlinked instead"));
            return false;
        }
    }

    private void unlinkListing(CascadeRun run, DeletionTarget target, BusinessListing listing) {
        if (listing.isUnlinked()) {
            log.debug("Listing {} ({}) already unlinked", listing.getId(), listing.getName());
            return;
        }
        try {
            businessListingRepository.unlinkById(listing.getId(), Instant.now());
            run.softDeleted++;
            log.info("Unlinked listing {} ({})", listing.getId(), listing.getName());
        } catch (DataAccessException e) {
            log.error("Failed to unlink listing {} ({})", listing.getId(), listing.getName(), e);
            run.failures.add(new DeletionFailure(target.getTable(),
                    "unlink of listing " + listing.getId() + " failed: " + reason(e)));
        }
    }

    private void runStep(CascadeRun run, String table, IntSupplier statement) {
        try {
            int removed = statement.getAsInt();
            run.recordRemoved(table, removed);
            log.debug("Removed {} row(s) from {}", removed, table);
        } catch (DataAccessException e) {
            log.error("Deletion step for {} failed, continuing with remaining steps", table, e);
            run.recordFailure(table, e);
        }
    }

    private void writeAudit(DeletionReport report, DeletionOptions options) {
        if (!properties.getDeletion().isAuditEnabled()) {
            return;
        }
        try {
            deletionAuditRepository.save(DeletionAuditEntry.builder()
                    .targetIdentityId(report.identityId())
                    .targetEmail(report.email())
                    .identityKind(report.identityKind())
                    .requestedBy(options.getRequestedBy())
                    .hardDeleteOwned(options.isHardDeleteOwnedEntities())
                    .ownedHardDeleted(report.ownedEntityDisposition().hardDeleted())
                    .ownedSoftDeleted(report.ownedEntityDisposition().softDeleted())
                    .failureCount(report.failures().size())
                    .authRecordRemoved(report.authRecordRemoved())
                    .build());
        } catch (DataAccessException e) {
            log.warn("Could not write deletion audit entry for {}", report.identityId(), e);
        }
    }

    private void publishDeleted(DeletionReport report) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("identityKind", report.identityKind().name());
        attributes.put("ownedHardDeleted", report.ownedEntityDisposition().hardDeleted());
        attributes.put("ownedSoftDeleted", report.ownedEntityDisposition().softDeleted());
        attributes.put("failures", report.failures().size());
        eventPublisher.publish(AccountEvent.of(AccountEventType.ACCOUNT_DELETED,
                report.identityId(), report.email(), attributes));
    }

    private static String describe(ResolvedIdentity identity) {
        return identity.identityId().map(UUID::toString).orElse(identity.email());
    }

    private static String reason(DataAccessException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Mutable state of one deletion request.
     */
    private static final class CascadeRun {
        private final ResolvedIdentity identity;
        private final DeletionOptions options;
        private final Map<String, Integer> removedCounts = new LinkedHashMap<>();
        private final List<DeletionFailure> failures = new ArrayList<>();
        private int hardDeleted;
        private int softDeleted;
        private boolean authRecordRemoved;

        private CascadeRun(ResolvedIdentity identity, DeletionOptions options) {
            this.identity = identity;
            this.options = options;
        }

        private void recordRemoved(String table, int count) {
            removedCounts.merge(table, count, Integer::sum);
        }

        private void recordFailure(String table, DataAccessException e) {
            failures.add(new DeletionFailure(table, reason(e)));
        }

        private DeletionReport toReport() {
            return new DeletionReport(identity.kind(), identity.identityId().orElse(null), identity.email(),
                    removedCounts, new OwnedEntityDisposition(hardDeleted, softDeleted), failures,
                    authRecordRemoved);
        }
    }
}
