/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import java.util.Objects;

/**
 * An error produced by an account lifecycle operation.
 */
public record AccountError(ErrorKind kind, String message) {

    public AccountError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static AccountError validation(String message) {
        return new AccountError(ErrorKind.VALIDATION, message);
    }

    public static AccountError notFound(String identityOrEmail) {
        return new AccountError(ErrorKind.NOT_FOUND, "No account data found for: " + identityOrEmail);
    }

    public static AccountError partialFailure(int failedSteps) {
        return new AccountError(ErrorKind.PARTIAL_FAILURE,
                String.format("%d deletion step(s) failed", failedSteps));
    }

    public static AccountError persistence(String operation, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "storage error";
        return new AccountError(ErrorKind.PERSISTENCE, operation + " failed: " + detail);
    }
}
