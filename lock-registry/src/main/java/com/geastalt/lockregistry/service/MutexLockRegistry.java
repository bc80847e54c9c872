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
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock registry guarded by one mutex over an ordered map.
 * Every operation serializes, including those on unrelated keys.
 */
@Slf4j
public class MutexLockRegistry implements LockRegistry {

    private final Map<String, LockRecord> locks;
    private final Lock mutex = new ReentrantLock();

    public MutexLockRegistry() {
        this(Map.of());
    }

    /**
     * Creates a registry pre-seeded with the given records.
     */
    public MutexLockRegistry(Map<String, LockRecord> initialLocks) {
        this.locks = new TreeMap<>(initialLocks);
    }

    @Override
    public LockResult<LockRecord> acquire(String key, String token) {
        var lockRecord = new LockRecord(token);

        mutex.lock();
        try {
            var previous = locks.put(key, lockRecord);
            log.debug("Lock acquired: {} (replaced existing: {})", key, previous != null);
        } finally {
            mutex.unlock();
        }

        return LockResult.success(lockRecord);
    }

    @Override
    public LockResult<LockRecord> release(String key) {
        LockRecord removed;

        mutex.lock();
        try {
            removed = locks.remove(key);
        } finally {
            mutex.unlock();
        }

        if (removed == null) {
            log.debug("Release of unknown lock: {}", key);
            return LockResult.notFound(key);
        }

        log.debug("Lock released: {}", key);
        return LockResult.success(removed);
    }

    @Override
    public int purgeAll() {
        int purged;

        mutex.lock();
        try {
            purged = locks.size();
            locks.clear();
        } finally {
            mutex.unlock();
        }

        log.warn("All locks purged: {} removed", purged);
        return purged;
    }

    @Override
    public int size() {
        mutex.lock();
        try {
            return locks.size();
        } finally {
            mutex.unlock();
        }
    }
}
