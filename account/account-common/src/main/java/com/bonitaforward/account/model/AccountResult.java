/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.bonitaforward.account.model;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a success carrying data or a failure carrying an {@link AccountError}.
 * Services return it instead of throwing; the REST layer folds it into a response.
 */
public sealed interface AccountResult<T> {

    boolean isSuccess();

    /**
     * Gets the value if successful, throws if not.
     */
    T getValue();

    /**
     * Gets the error if failed, throws if successful.
     */
    AccountError getError();

    <U> AccountResult<U> map(Function<T, U> mapper);

    AccountResult<T> onFailure(Consumer<AccountError> consumer);

    /**
     * The success value, or the value computed from the error.
     */
    T orElseGet(Function<AccountError, T> fallback);

    static <T> AccountResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AccountResult<T> failure(AccountError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements AccountResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public AccountError getError() {
            throw new IllegalStateException("Cannot get error from success result");
        }

        @Override
        public <U> AccountResult<U> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public AccountResult<T> onFailure(Consumer<AccountError> consumer) {
            return this;
        }

        @Override
        public T orElseGet(Function<AccountError, T> fallback) {
            return value;
        }
    }

    record Failure<T>(AccountError error) implements AccountResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Cannot get value from failure result: " + error);
        }

        @Override
        public AccountError getError() {
            return error;
        }

        @Override
        public <U> AccountResult<U> map(Function<T, U> mapper) {
            return new Failure<>(error);
        }

        @Override
        public AccountResult<T> onFailure(Consumer<AccountError> consumer) {
            consumer.accept(error);
            return this;
        }

        @Override
        public T orElseGet(Function<AccountError, T> fallback) {
            return fallback.apply(error);
        }
    }
}
