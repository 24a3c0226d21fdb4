/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "account")
public class AccountProperties {

    private Events events = new Events();
    private Schema schema = new Schema();
    private Deletion deletion = new Deletion();

    @Data
    public static class Events {
        private boolean enabled = true;
        private Topics topics = new Topics();
    }

    @Data
    public static class Topics {
        private String profileUpdated = "account.profile-updated";
        private String accountDeleted = "account.account-deleted";
    }

    @Data
    public static class Schema {
        private boolean validateOnStartup = true;
    }

    @Data
    public static class Deletion {
        /** Re-read each hard-deleted listing to confirm the row is gone */
        private boolean verifyHardDeletes = true;
        private boolean auditEnabled = true;
    }
}
