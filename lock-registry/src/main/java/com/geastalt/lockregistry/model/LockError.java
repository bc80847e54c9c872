/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.model;

import java.util.Objects;

/**
 * Represents an error that occurred during a registry operation.
 */
public record LockError(
        LockStatus status,
        String key,
        String message
) {
    public LockError {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates an error for a key with no current record.
     */
    public static LockError notFound(String key) {
        return new LockError(
                LockStatus.NOT_FOUND,
                key,
                "Lock not found: " + key
        );
    }
}
