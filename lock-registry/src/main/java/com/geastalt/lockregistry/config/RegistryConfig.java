/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for registry behavior.
 */
@Configuration
@ConfigurationProperties(prefix = "lockregistry")
@Getter
@Setter
public class RegistryConfig {

    private RegistryStrategy strategy = RegistryStrategy.CONCURRENT;
}
