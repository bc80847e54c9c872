/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.web;

import com.geastalt.lockregistry.model.LockError;
import lombok.Getter;

/**
 * Thrown when a release names a key that holds no lock.
 */
@Getter
public class LockNotFoundException extends RuntimeException {

    private final LockError error;

    public LockNotFoundException(LockError error) {
        super(error.message());
        this.error = error;
    }
}
