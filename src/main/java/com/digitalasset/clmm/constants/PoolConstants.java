// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.constants;

/**
 * Centralized limits and defaults for pool operations.
 */
public final class PoolConstants {

    private PoolConstants() {
        // Prevent instantiation
    }

    // ========================================
    // POOL KEY LIMITS
    // ========================================

    /**
     * Smallest usable tick spacing.
     */
    public static final int MIN_TICK_SPACING = 1;

    /**
     * Largest usable tick spacing. Wider spacings would leave too few usable ticks.
     */
    public static final int MAX_TICK_SPACING = 16384;

    // ========================================
    // METRICS
    // ========================================

    public static final String DEFAULT_METRICS_PREFIX = "clearportx.clmm";

    /**
     * Failure reasons longer than this are truncated before being used as a metric tag.
     */
    public static final int MAX_REASON_TAG_LENGTH = 50;
}
