// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import com.digitalasset.clmm.math.Uint256;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Pair of signed int128 token amounts seen from the caller: negative means the caller owes
 * the pool, positive means the pool owes the caller.
 */
public record BalanceDelta(BigInteger amount0, BigInteger amount1) {

    public static final BalanceDelta ZERO = new BalanceDelta(BigInteger.ZERO, BigInteger.ZERO);

    public BalanceDelta {
        Objects.requireNonNull(amount0, "amount0");
        Objects.requireNonNull(amount1, "amount1");
        Uint256.toInt128(amount0);
        Uint256.toInt128(amount1);
    }

    public static BalanceDelta of(long amount0, long amount1) {
        return new BalanceDelta(BigInteger.valueOf(amount0), BigInteger.valueOf(amount1));
    }

    public BalanceDelta add(BalanceDelta other) {
        return new BalanceDelta(amount0.add(other.amount0), amount1.add(other.amount1));
    }

    public BalanceDelta subtract(BalanceDelta other) {
        return new BalanceDelta(amount0.subtract(other.amount0), amount1.subtract(other.amount1));
    }

    public boolean isZero() {
        return amount0.signum() == 0 && amount1.signum() == 0;
    }
}
