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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lock registry backed by a {@link ConcurrentHashMap}.
 *
 * <p>Per-key atomicity comes from the map's own bin locking, so acquire and
 * release on different keys never wait on each other. They share the read
 * side of {@code purgeLock}; purge takes the write side, so nobody sees a
 * half-cleared map.
 */
@Slf4j
public class ConcurrentLockRegistry implements LockRegistry {

    private final Map<String, LockRecord> locks;
    private final ReadWriteLock purgeLock = new ReentrantReadWriteLock();

    public ConcurrentLockRegistry() {
        this(Map.of());
    }

    /**
     * Creates a registry pre-seeded with the given records.
     */
    public ConcurrentLockRegistry(Map<String, LockRecord> initialLocks) {
        this.locks = new ConcurrentHashMap<>(initialLocks);
    }

    @Override
    public LockResult<LockRecord> acquire(String key, String token) {
        var lockRecord = new LockRecord(token);

        purgeLock.readLock().lock();
        try {
            var previous = locks.put(key, lockRecord);
            log.debug("Lock acquired: {} (replaced existing: {})", key, previous != null);
        } finally {
            purgeLock.readLock().unlock();
        }

        return LockResult.success(lockRecord);
    }

    @Override
    public LockResult<LockRecord> release(String key) {
        LockRecord removed;

        purgeLock.readLock().lock();
        try {
            removed = locks.remove(key);
        } finally {
            purgeLock.readLock().unlock();
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

        purgeLock.writeLock().lock();
        try {
            purged = locks.size();
            locks.clear();
        } finally {
            purgeLock.writeLock().unlock();
        }

        log.warn("All locks purged: {} removed", purged);
        return purged;
    }

    @Override
    public int size() {
        return locks.size();
    }
}
