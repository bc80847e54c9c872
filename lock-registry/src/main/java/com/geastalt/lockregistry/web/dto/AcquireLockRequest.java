/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.lockregistry.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /lock/{key}}.
 */
public record AcquireLockRequest(@NotNull String token) {
}
