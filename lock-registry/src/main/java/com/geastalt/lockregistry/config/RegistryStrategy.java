/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.config;

import com.geastalt.lockregistry.service.ConcurrentLockRegistry;
import com.geastalt.lockregistry.service.LockRegistry;
import com.geastalt.lockregistry.service.MutexLockRegistry;

/**
 * Selects how the registry map is protected.
 */
public enum RegistryStrategy {
    /**
     * Concurrent hash map; different keys proceed in parallel.
     */
    CONCURRENT,

    /**
     * Single mutex over an ordered map; all operations serialize.
     */
    MUTEX;

    /**
     * Creates an empty registry of this kind.
     */
    public LockRegistry newRegistry() {
        return switch (this) {
            case CONCURRENT -> new ConcurrentLockRegistry();
            case MUTEX -> new MutexLockRegistry();
        };
    }
}
