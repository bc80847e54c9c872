/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.model;

import java.util.function.Function;

/**
 * Outcome of a registry call: the record it produced, or the reason there
 * is none.
 */
public sealed interface LockResult<T> {

    boolean isSuccess();

    /**
     * @throws IllegalStateException on a failed result
     */
    T getValue();

    /**
     * @throws IllegalStateException on a successful result
     */
    LockError getError();

    /**
     * Unwraps the value, or throws whatever the factory builds from the error.
     */
    <X extends RuntimeException> T orElseThrow(Function<LockError, X> exceptionFactory);

    static <T> LockResult<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * Creates a failed result for a key with no current record.
     */
    static <T> LockResult<T> notFound(String key) {
        return new Failure<>(LockError.notFound(key));
    }

    record Success<T>(T value) implements LockResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public LockError getError() {
            throw new IllegalStateException("Successful result has no error");
        }

        @Override
        public <X extends RuntimeException> T orElseThrow(Function<LockError, X> exceptionFactory) {
            return value;
        }
    }

    record Failure<T>(LockError error) implements LockResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("No value for failed result: " + error.message());
        }

        @Override
        public LockError getError() {
            return error;
        }

        @Override
        public <X extends RuntimeException> T orElseThrow(Function<LockError, X> exceptionFactory) {
            throw exceptionFactory.apply(error);
        }
    }
}
