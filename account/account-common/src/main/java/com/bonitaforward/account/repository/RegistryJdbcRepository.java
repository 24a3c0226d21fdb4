/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.repository;

import com.bonitaforward.account.registry.DeletionTarget;
import com.bonitaforward.account.registry.KeyType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Table-generic statements driven by {@link DeletionTarget}. Table and column names come
 * from the enum only, never from callers, so they are safe to splice into SQL.
 */
@Repository
@RequiredArgsConstructor
public class RegistryJdbcRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public int deleteByIdentity(DeletionTarget target, UUID identityId) {
        requireKeyType(target, KeyType.BY_ID);
        String sql = "DELETE FROM " + target.getTable() + " WHERE " + target.getKeyColumn() + " = :key";
        return jdbc.update(sql, new MapSqlParameterSource("key", identityId));
    }

    public int deleteByEmail(DeletionTarget target, String normalizedEmail) {
        String sql = "DELETE FROM " + target.getTable()
                + " WHERE LOWER(" + emailColumn(target) + ") = :email";
        return jdbc.update(sql, new MapSqlParameterSource("email", normalizedEmail));
    }

    public long countByIdentity(DeletionTarget target, UUID identityId) {
        requireKeyType(target, KeyType.BY_ID);
        String sql = "SELECT COUNT(*) FROM " + target.getTable() + " WHERE " + target.getKeyColumn() + " = :key";
        Long count = jdbc.queryForObject(sql, new MapSqlParameterSource("key", identityId), Long.class);
        return count != null ? count : 0;
    }

    public long countByEmail(DeletionTarget target, String normalizedEmail) {
        String sql = "SELECT COUNT(*) FROM " + target.getTable()
                + " WHERE LOWER(" + emailColumn(target) + ") = :email";
        Long count = jdbc.queryForObject(sql, new MapSqlParameterSource("email", normalizedEmail), Long.class);
        return count != null ? count : 0;
    }

    /**
     * Issues a query that touches the given column without reading any rows.
     * Fails with a {@link org.springframework.dao.DataAccessException} when the table or column is missing.
     */
    public void probeColumn(String table, String column) {
        jdbc.getJdbcTemplate().execute("SELECT " + column + " FROM " + table + " WHERE 1 = 0");
    }

    private static String emailColumn(DeletionTarget target) {
        if (!target.isMatchableByEmail()) {
            throw new IllegalArgumentException(target + " cannot be matched by e-mail");
        }
        return target.getEmailColumn();
    }

    private static void requireKeyType(DeletionTarget target, KeyType expected) {
        if (target.getKeyType() != expected) {
            throw new IllegalArgumentException(target + " is keyed " + target.getKeyType() + ", not " + expected);
        }
    }
}
