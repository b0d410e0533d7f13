// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.model;

import java.util.Objects;

/**
 * Unique identity of a pool. {@code currency0} must sort strictly below {@code currency1}.
 *
 * @param fee         static LP fee in hundredths of a bip, or the dynamic-fee flag
 * @param tickSpacing distance between usable ticks, in [1, 16384]
 * @param hooks       extension address, {@link Address#ZERO} for none
 */
public record PoolKey(Address currency0, Address currency1, int fee, int tickSpacing, Address hooks) {

    public PoolKey {
        Objects.requireNonNull(currency0, "currency0");
        Objects.requireNonNull(currency1, "currency1");
        Objects.requireNonNull(hooks, "hooks");
    }

    public static PoolKey of(Address currency0, Address currency1, int fee, int tickSpacing) {
        return new PoolKey(currency0, currency1, fee, tickSpacing, Address.ZERO);
    }

    /**
     * Short, bounded-cardinality label for logs and metric tags.
     */
    public String label() {
        return shortHex(currency0) + "-" + shortHex(currency1) + "/" + fee + "/" + tickSpacing;
    }

    private static String shortHex(Address address) {
        String hex = address.toString();
        return hex.substring(0, 6) + ".." + hex.substring(hex.length() - 4);
    }
}
