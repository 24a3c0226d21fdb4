/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role chosen by a user at signup. Once stored on a profile it can no longer be changed.
 */
public enum AccountRole {
    BUSINESS("business"),
    COMMUNITY("community");

    private final String code;

    AccountRole(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static AccountRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (AccountRole role : values()) {
            if (role.code.equalsIgnoreCase(code.trim())) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown account role: " + code);
    }
}
