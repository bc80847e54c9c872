/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.config;

import com.geastalt.lockregistry.service.LockRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the single registry instance shared by every request handler.
 */
@Slf4j
@Configuration
public class RegistryConfiguration {

    @Bean
    public LockRegistry lockRegistry(RegistryConfig registryConfig) {
        var strategy = registryConfig.getStrategy();
        log.info("Creating lock registry with strategy: {}", strategy);
        return strategy.newRegistry();
    }
}
