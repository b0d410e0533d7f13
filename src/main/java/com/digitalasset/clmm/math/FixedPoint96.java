// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import java.math.BigInteger;

/**
 * Q64.96 fixed-point helpers. Square-root prices are stored in this format.
 */
public final class FixedPoint96 {

    public static final int RESOLUTION = 96;
    public static final BigInteger Q96 = BigInteger.ONE.shiftLeft(RESOLUTION);

    private FixedPoint96() {
    }

    /**
     * Multiplies two Q64.96 numbers, rounding down.
     */
    public static BigInteger mul(BigInteger a, BigInteger b) {
        return FullMath.mulDiv(a, b, Q96);
    }

    /**
     * Divides two Q64.96 numbers, rounding down.
     */
    public static BigInteger div(BigInteger a, BigInteger b) {
        return FullMath.mulDiv(a, Q96, b);
    }

    public static BigInteger fromInteger(long value) {
        return BigInteger.valueOf(value).shiftLeft(RESOLUTION);
    }
}
