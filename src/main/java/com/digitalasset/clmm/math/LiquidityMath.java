// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

public final class LiquidityMath {

    private LiquidityMath() {
    }

    /**
     * Adds a signed int128 delta to an unsigned uint128 liquidity value.
     *
     * @throws com.digitalasset.clmm.common.DomainException OVERFLOW when the result leaves
     *         [0, 2^128)
     */
    public static BigInteger addDelta(BigInteger x, BigInteger delta) {
        Uint256.requireUint128(x, "liquidity");
        Uint256.toInt128(delta);
        BigInteger result = x.add(delta);
        if (result.signum() < 0) {
            throw MathError.overflow("liquidity underflow: " + x + " + (" + delta + ")");
        }
        if (!Uint256.isUint128(result)) {
            throw MathError.overflow("liquidity overflow: " + x + " + " + delta);
        }
        return result;
    }
}
