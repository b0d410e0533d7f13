// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import java.math.BigInteger;

/**
 * Bit scans over unsigned 256-bit words.
 */
public final class BitMath {

    private BitMath() {
    }

    /**
     * Index of the most significant set bit, so that {@code 2^msb <= x < 2^(msb+1)}.
     *
     * @throws IllegalArgumentException if x is zero, negative or wider than 256 bits
     */
    public static int mostSignificantBit(BigInteger x) {
        requirePositiveWord(x);
        return x.bitLength() - 1;
    }

    /**
     * Index of the least significant set bit, so that {@code x & (2^lsb) != 0} and no lower
     * bit is set.
     *
     * @throws IllegalArgumentException if x is zero, negative or wider than 256 bits
     */
    public static int leastSignificantBit(BigInteger x) {
        requirePositiveWord(x);
        return x.getLowestSetBit();
    }

    private static void requirePositiveWord(BigInteger x) {
        if (x.signum() <= 0 || x.bitLength() > 256) {
            throw new IllegalArgumentException("bit scan requires 0 < x < 2^256, got " + x);
        }
    }
}
