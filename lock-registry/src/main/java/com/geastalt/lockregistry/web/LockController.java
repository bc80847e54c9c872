/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.web;

import com.geastalt.lockregistry.model.LockRecord;
import com.geastalt.lockregistry.service.LockRegistry;
import com.geastalt.lockregistry.web.dto.AcquireLockRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP front end for the lock registry. Each handler makes exactly one
 * registry call.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class LockController {

    private final LockRegistry lockRegistry;

    @PostMapping("/lock/{key}")
    public ResponseEntity<Void> acquire(
            @PathVariable("key") String key,
            @Valid @RequestBody AcquireLockRequest request) {
        log.debug("HTTP acquire: key={}", key);

        lockRegistry.acquire(key, request.token());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @PostMapping("/unlock/{key}")
    public ResponseEntity<LockRecord> release(@PathVariable("key") String key) {
        log.debug("HTTP release: key={}", key);

        LockRecord released = lockRegistry.release(key)
                .orElseThrow(LockNotFoundException::new);
        return ResponseEntity.ok(released);
    }

    @PostMapping("/purge")
    public ResponseEntity<Void> purge() {
        lockRegistry.purgeAll();
        return ResponseEntity.ok().build();
    }
}
