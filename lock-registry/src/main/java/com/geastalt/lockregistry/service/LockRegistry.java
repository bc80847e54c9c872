/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.service;

import com.geastalt.lockregistry.model.LockRecord;
import com.geastalt.lockregistry.model.LockResult;

/**
 * In-memory registry mapping lock keys to lock records.
 *
 * <p>Implementations guarantee that acquire and release on the same key are
 * atomic with respect to each other, and that {@link #purgeAll()} is atomic
 * with respect to the whole registry. No ordering is promised between
 * racing calls on one key.
 */
public interface LockRegistry {

    /**
     * Stores the token under the key, replacing any record already there.
     * The replaced token is discarded.
     *
     * @param key   The lock key
     * @param token The caller's opaque token
     * @return Always a success, carrying the stored record
     */
    LockResult<LockRecord> acquire(String key, String token);

    /**
     * Removes the record for the key and returns it. The token is not
     * checked; whoever names the key releases it.
     *
     * @param key The lock key
     * @return The removed record, or a NOT_FOUND failure if the key is free
     */
    LockResult<LockRecord> release(String key);

    /**
     * Discards every record.
     *
     * @return The number of records discarded
     */
    int purgeAll();

    /**
     * Gets the number of records currently held.
     */
    int size();
}
