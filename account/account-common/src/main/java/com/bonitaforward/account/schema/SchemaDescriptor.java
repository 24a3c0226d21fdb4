/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.schema;

import com.bonitaforward.account.registry.DeletionTarget;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The tables and columns this service reads or writes, tied to the migration version that
 * introduced them. Checked against the live database at startup.
 *
 * @param version lowest applied migration version the code works with
 * @param columnsByTable required columns per table
 */
public record SchemaDescriptor(String version, Map<String, Set<String>> columnsByTable) {

    public static final String CURRENT_VERSION = "2";

    public static SchemaDescriptor current() {
        Map<String, Set<String>> columns = new LinkedHashMap<>();
        for (DeletionTarget target : DeletionTarget.values()) {
            Set<String> required = columns.computeIfAbsent(target.getTable(), t -> new LinkedHashSet<>());
            required.add(target.getKeyColumn());
            if (target.isMatchableByEmail()) {
                required.add(target.getEmailColumn());
            }
        }
        columns.get("profiles").addAll(List.of("email", "name", "role", "is_resident",
                "resident_verification_method", "resident_zip_code", "resident_verified_at",
                "email_notifications_enabled", "marketing_emails_enabled", "created_at", "updated_at"));
        columns.get("providers").addAll(List.of("id", "name", "unlinked", "created_at", "updated_at"));
        columns.put("auth_users", new LinkedHashSet<>(List.of("id", "email")));
        columns.put("account_deletion_audit", new LinkedHashSet<>(List.of("id", "target_identity_id",
                "target_email", "identity_kind", "requested_by", "failure_count", "created_at")));
        return new SchemaDescriptor(CURRENT_VERSION, columns);
    }

    public List<String> qualifiedColumns() {
        List<String> qualified = new ArrayList<>();
        columnsByTable.forEach((table, cols) -> cols.forEach(col -> qualified.add(table + "." + col)));
        return qualified;
    }
}
