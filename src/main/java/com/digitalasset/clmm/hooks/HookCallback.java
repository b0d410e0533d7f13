// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

/**
 * Points at which a pool calls into its extension, plus the flags that let an extension
 * return balance deltas.
 */
public enum HookCallback {
    BEFORE_INITIALIZE,
    AFTER_INITIALIZE,
    BEFORE_ADD_LIQUIDITY,
    AFTER_ADD_LIQUIDITY,
    BEFORE_REMOVE_LIQUIDITY,
    AFTER_REMOVE_LIQUIDITY,
    BEFORE_SWAP,
    AFTER_SWAP,
    BEFORE_DONATE,
    AFTER_DONATE,
    BEFORE_SWAP_RETURNS_DELTA(BEFORE_SWAP),
    AFTER_SWAP_RETURNS_DELTA(AFTER_SWAP),
    AFTER_ADD_LIQUIDITY_RETURNS_DELTA(AFTER_ADD_LIQUIDITY),
    AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA(AFTER_REMOVE_LIQUIDITY);

    private final HookCallback requires;

    HookCallback() {
        this(null);
    }

    HookCallback(HookCallback requires) {
        this.requires = requires;
    }

    /**
     * The callback this flag depends on, or null for plain callbacks.
     */
    public HookCallback requires() {
        return requires;
    }
}
