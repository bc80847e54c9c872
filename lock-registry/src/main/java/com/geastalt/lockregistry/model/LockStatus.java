/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.model;

/**
 * Why a registry operation failed. Acquire and purge cannot fail, so the
 * only kind is a release of a key that holds nothing.
 */
public enum LockStatus {
    /**
     * No record exists for the key. Covers keys that were never acquired
     * as well as keys already released or purged.
     */
    NOT_FOUND;

    /**
     * A missing key stays missing until someone acquires it again, so
     * retrying never helps.
     */
    public boolean isRetryable() {
        return false;
    }
}
