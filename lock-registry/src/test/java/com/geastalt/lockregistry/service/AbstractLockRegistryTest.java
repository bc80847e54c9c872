/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.service;

import com.geastalt.lockregistry.model.LockRecord;
import com.geastalt.lockregistry.model.LockStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every LockRegistry implementation must share.
 */
abstract class AbstractLockRegistryTest {

    private static final int THREADS = 16;

    protected LockRegistry registry;

    protected abstract LockRegistry createRegistry(Map<String, LockRecord> initialLocks);

    @BeforeEach
    void setUp() {
        registry = createRegistry(Map.of());
    }

    @Test
    @DisplayName("Should return acquired token on release")
    void shouldReturnAcquiredTokenOnRelease() {
        var acquireResult = registry.acquire("room1", "tok-abc");
        assertTrue(acquireResult.isSuccess());
        assertEquals("tok-abc", acquireResult.getValue().token());

        var releaseResult = registry.release("room1");
        assertTrue(releaseResult.isSuccess());
        assertEquals("tok-abc", releaseResult.getValue().token());
    }

    @Test
    @DisplayName("Should fail second release with not found")
    void shouldFailSecondRelease() {
        registry.acquire("room1", "tok-abc");
        registry.release("room1");

        var secondRelease = registry.release("room1");

        assertFalse(secondRelease.isSuccess());
        assertEquals(LockStatus.NOT_FOUND, secondRelease.getError().status());
        assertEquals("room1", secondRelease.getError().key());
    }

    @Test
    @DisplayName("Should fail release of unknown key")
    void shouldFailReleaseOfUnknownKey() {
        var result = registry.release("nope");

        assertFalse(result.isSuccess());
        assertEquals(LockStatus.NOT_FOUND, result.getError().status());
    }

    @Test
    @DisplayName("Should let later acquire overwrite earlier token")
    void shouldOverwriteOnAcquire() {
        registry.acquire("room1", "t1");
        registry.acquire("room1", "t2");

        assertEquals(1, registry.size());
        assertEquals("t2", registry.release("room1").getValue().token());
        assertFalse(registry.release("room1").isSuccess());
    }

    @Test
    @DisplayName("Should release without checking token")
    void shouldReleaseWithoutCheckingToken() {
        registry.acquire("room1", "owner-token");

        // Release takes only the key; any caller naming it gets the token back
        var result = registry.release("room1");

        assertEquals("owner-token", result.getValue().token());
    }

    @Test
    @DisplayName("Should keep different keys independent")
    void shouldKeepDifferentKeysIndependent() {
        registry.acquire("a", "x");
        registry.acquire("b", "y");

        assertEquals("x", registry.release("a").getValue().token());
        assertEquals("y", registry.release("b").getValue().token());
    }

    @Test
    @DisplayName("Should purge empty registry without error")
    void shouldPurgeEmptyRegistry() {
        assertEquals(0, registry.purgeAll());
        assertEquals(0, registry.size());
        assertEquals(0, registry.purgeAll());
    }

    @Test
    @DisplayName("Should drop every lock on purge")
    void shouldDropEveryLockOnPurge() {
        registry.acquire("room1", "t1");
        registry.acquire("room2", "t2");
        registry.acquire("room3", "t3");

        assertEquals(3, registry.purgeAll());

        assertEquals(0, registry.size());
        for (var key : List.of("room1", "room2", "room3")) {
            assertEquals(LockStatus.NOT_FOUND, registry.release(key).getError().status());
        }
    }

    @Test
    @DisplayName("Should accept acquire after purge")
    void shouldAcceptAcquireAfterPurge() {
        registry.acquire("room1", "t1");
        registry.purgeAll();

        registry.acquire("room1", "t2");

        assertEquals("t2", registry.release("room1").getValue().token());
    }

    @Test
    @DisplayName("Should start with seeded records")
    void shouldStartWithSeededRecords() {
        registry = createRegistry(Map.of("seeded", new LockRecord("seed-token")));

        assertEquals(1, registry.size());
        assertEquals("seed-token", registry.release("seeded").getValue().token());
    }

    @Test
    @DisplayName("Should reject null token")
    void shouldRejectNullToken() {
        assertThrows(NullPointerException.class, () -> registry.acquire("room1", null));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should keep all keys when acquired concurrently")
    void shouldKeepAllKeysWhenAcquiredConcurrently() throws Exception {
        int keysPerThread = 200;
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final int threadNum = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < keysPerThread; i++) {
                        registry.acquire("key-" + threadNum + "-" + i, "token-" + threadNum + "-" + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(THREADS * keysPerThread, registry.size());
        for (int t = 0; t < THREADS; t++) {
            for (int i = 0; i < keysPerThread; i++) {
                var result = registry.release("key-" + t + "-" + i);
                assertEquals("token-" + t + "-" + i, result.getValue().token());
            }
        }
    }

    @Test
    @DisplayName("Should hand a held lock to exactly one concurrent releaser")
    void shouldHandHeldLockToExactlyOneReleaser() throws Exception {
        var key = UUID.randomUUID().toString();
        registry.acquire(key, "only-once");

        var successCount = new AtomicInteger(0);
        var start = new CountDownLatch(1);
        var done = new CountDownLatch(THREADS);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            for (int i = 0; i < THREADS; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        if (registry.release(key).isSuccess()) {
                            successCount.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, successCount.get());
    }

    @Test
    @DisplayName("Should leave exactly one winning token when one key is contended")
    void shouldLeaveOneWinningTokenUnderContention() throws Exception {
        var key = "contended";
        var start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                final String token = "writer-" + t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        registry.acquire(key, token);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, registry.size());
        var winner = registry.release(key).getValue().token();
        assertTrue(winner.startsWith("writer-"));
        assertFalse(registry.release(key).isSuccess());
    }

    @Test
    @DisplayName("Should never expose a partially purged registry")
    void shouldNeverExposePartiallyPurgedRegistry() throws Exception {
        int rounds = 50;
        int batch = 500;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < rounds; round++) {
                registry.purgeAll();
                var start = new CountDownLatch(1);
                var writerDone = new AtomicBoolean(false);

                // The writer fills keys in order while the purger keeps clearing,
                // so purges land between arbitrary pairs of acquires.
                Future<?> writer = executor.submit(() -> {
                    start.await();
                    try {
                        for (int i = 0; i < batch; i++) {
                            registry.acquire("key-" + i, "t" + i);
                        }
                    } finally {
                        writerDone.set(true);
                    }
                    return null;
                });
                Future<Integer> purger = executor.submit(() -> {
                    start.await();
                    int purges = 0;
                    while (!writerDone.get()) {
                        registry.purgeAll();
                        purges++;
                    }
                    return purges;
                });
                start.countDown();
                writer.get(10, TimeUnit.SECONDS);
                assertTrue(purger.get(10, TimeUnit.SECONDS) >= 0);

                // An atomic purge only ever removes a prefix of the writes; the
                // survivors are exactly the keys written after the last purge.
                int survivors = registry.size();
                int firstSurvivor = batch - survivors;
                for (int i = 0; i < firstSurvivor; i++) {
                    assertFalse(registry.release("key-" + i).isSuccess(),
                            "round " + round + ": key-" + i + " outlived a later purge");
                }
                for (int i = firstSurvivor; i < batch; i++) {
                    assertEquals("t" + i, registry.release("key-" + i).getValue().token(),
                            "round " + round + ": key-" + i + " lost without a purge after it");
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
