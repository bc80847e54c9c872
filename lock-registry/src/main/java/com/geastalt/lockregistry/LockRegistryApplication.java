/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main application class for the Lock Registry.
 *
 * <p>A single-process, in-memory registry of named locks exposed over HTTP:
 * <ul>
 *   <li>POST /lock/{key} - store a caller supplied token under a key</li>
 *   <li>POST /unlock/{key} - remove the key and return its token</li>
 *   <li>POST /purge - drop every lock</li>
 * </ul>
 *
 * <p>Acquire always overwrites and release never checks the token. Nothing
 * survives a restart.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class LockRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(LockRegistryApplication.class, args);
    }
}
