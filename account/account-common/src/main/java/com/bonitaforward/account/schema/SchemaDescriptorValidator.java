/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.schema;

import com.bonitaforward.account.config.AccountProperties;
import com.bonitaforward.account.repository.RegistryJdbcRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationVersion;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fails startup when the database does not carry every table and column in the
 * {@link SchemaDescriptor}, so a missing column never degrades into empty query results.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaDescriptorValidator {

    private final RegistryJdbcRepository registryJdbcRepository;
    private final ObjectProvider<Flyway> flywayProvider;
    private final AccountProperties properties;

    @PostConstruct
    void validateOnStartup() {
        if (!properties.getSchema().isValidateOnStartup()) {
            log.warn("Schema validation on startup is disabled");
            return;
        }
        validate(SchemaDescriptor.current());
    }

    public void validate(SchemaDescriptor descriptor) {
        List<String> problems = new ArrayList<>();
        checkVersion(descriptor, problems);

        for (Map.Entry<String, Set<String>> entry : descriptor.columnsByTable().entrySet()) {
            for (String column : entry.getValue()) {
                try {
                    registryJdbcRepository.probeColumn(entry.getKey(), column);
                } catch (DataAccessException e) {
                    problems.add("missing " + entry.getKey() + "." + column);
                }
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Database schema does not match descriptor version "
                    + descriptor.version() + ": " + String.join(", ", problems));
        }
        log.info("Schema descriptor version {} validated ({} columns)",
                descriptor.version(), descriptor.qualifiedColumns().size());
    }

    private void checkVersion(SchemaDescriptor descriptor, List<String> problems) {
        Flyway flyway = flywayProvider.getIfAvailable();
        if (flyway == null) {
            log.debug("No Flyway instance available, skipping migration version check");
            return;
        }
        MigrationInfo current = flyway.info().current();
        MigrationVersion required = MigrationVersion.fromVersion(descriptor.version());
        if (current == null || current.getVersion().compareTo(required) < 0) {
            problems.add("migration version " + (current == null ? "none" : current.getVersion())
                    + " is older than required " + required);
        }
    }
}
