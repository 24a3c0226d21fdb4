/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcAuthRecordStore implements AuthRecordStore {

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public boolean exists(UUID identityId) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM auth_users WHERE id = :id",
                new MapSqlParameterSource("id", identityId), Long.class);
        return count != null && count > 0;
    }

    @Override
    public Optional<UUID> findIdentityIdByEmail(String normalizedEmail) {
        List<UUID> ids = jdbc.queryForList(
                "SELECT id FROM auth_users WHERE LOWER(email) = :email",
                new MapSqlParameterSource("email", normalizedEmail), UUID.class);
        if (ids.size() > 1) {
            log.warn("Found {} auth records for the same e-mail, using the first", ids.size());
        }
        return ids.stream().findFirst();
    }

    @Override
    public Optional<String> findEmail(UUID identityId) {
        List<String> emails = jdbc.queryForList(
                "SELECT email FROM auth_users WHERE id = :id",
                new MapSqlParameterSource("id", identityId), String.class);
        return emails.stream().findFirst();
    }

    @Override
    public Removal remove(UUID identityId) {
        int removed = jdbc.update("DELETE FROM auth_users WHERE id = :id",
                new MapSqlParameterSource("id", identityId));
        return removed > 0 ? Removal.REMOVED : Removal.ALREADY_ABSENT;
    }
}
