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
 * The value held in the registry for a lock key.
 *
 * <p>The token is opaque: it is stored as given on acquire and handed back
 * unchanged on release. The registry never compares or validates it.
 * Serializes as {@code {"token": "..."}}.
 */
public record LockRecord(String token) {

    public LockRecord {
        Objects.requireNonNull(token, "token must not be null");
    }
}
