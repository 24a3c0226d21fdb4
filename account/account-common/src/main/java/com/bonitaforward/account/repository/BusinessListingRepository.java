/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.repository;

import com.bonitaforward.account.entity.BusinessListing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface BusinessListingRepository extends JpaRepository<BusinessListing, UUID> {

    List<BusinessListing> findByOwnerIdentityId(UUID ownerIdentityId);

    @Query("SELECT b FROM BusinessListing b WHERE LOWER(b.email) = :email AND b.unlinked = true")
    List<BusinessListing> findUnlinkedByNormalizedEmail(@Param("email") String email);

    @Query("SELECT b FROM BusinessListing b WHERE LOWER(b.email) = :email AND b.ownerIdentityId IS NULL")
    List<BusinessListing> findUnownedByNormalizedEmail(@Param("email") String email);

    @Query("SELECT COUNT(b) FROM BusinessListing b WHERE LOWER(b.email) = :email")
    long countByNormalizedEmail(@Param("email") String email);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM BusinessListing b WHERE b.id = :id")
    int hardDeleteById(@Param("id") UUID id);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE BusinessListing b SET b.ownerIdentityId = NULL, b.unlinked = true, "
            + "b.updatedAt = :now WHERE b.id = :id")
    int unlinkById(@Param("id") UUID id, @Param("now") Instant now);
}
