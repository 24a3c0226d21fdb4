/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.dto;

import com.bonitaforward.account.model.AccountError;
import com.bonitaforward.account.model.AccountResult;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire form of {@link AccountResult}: {@code {success: true, data}} or {@code {success: false, error}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountResponse<T>(boolean success, T data, AccountError error) {

    public static <T> AccountResponse<T> success(T data) {
        return new AccountResponse<>(true, data, null);
    }

    public static <T> AccountResponse<T> failure(AccountError error) {
        return new AccountResponse<>(false, null, error);
    }
}
