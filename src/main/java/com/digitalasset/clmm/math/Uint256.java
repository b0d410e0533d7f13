// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

/**
 * Range constants and checked / wrapping helpers for fixed-width integers held in
 * {@link BigInteger}.
 *
 * Fee-growth accumulators wrap modulo 2^256; every other quantity is range-checked and
 * fails with {@link MathError.Kind#OVERFLOW} when it leaves its width.
 */
public final class Uint256 {

    private Uint256() {
        // Prevent instantiation
    }

    public static final BigInteger TWO_POW_128 = BigInteger.ONE.shiftLeft(128);
    public static final BigInteger TWO_POW_256 = BigInteger.ONE.shiftLeft(256);

    public static final BigInteger MAX_UINT256 = TWO_POW_256.subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT160 = BigInteger.ONE.shiftLeft(160).subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT128 = TWO_POW_128.subtract(BigInteger.ONE);

    public static final BigInteger MAX_INT128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    public static final BigInteger MIN_INT128 = BigInteger.ONE.shiftLeft(127).negate();

    public static boolean isUint256(BigInteger x) {
        return x.signum() >= 0 && x.bitLength() <= 256;
    }

    public static boolean isUint160(BigInteger x) {
        return x.signum() >= 0 && x.bitLength() <= 160;
    }

    public static boolean isUint128(BigInteger x) {
        return x.signum() >= 0 && x.bitLength() <= 128;
    }

    public static boolean isInt128(BigInteger x) {
        return x.compareTo(MIN_INT128) >= 0 && x.compareTo(MAX_INT128) <= 0;
    }

    public static BigInteger requireUint256(BigInteger x, String name) {
        if (!isUint256(x)) {
            throw MathError.overflow(name + " is not a uint256: " + x);
        }
        return x;
    }

    public static BigInteger requireUint128(BigInteger x, String name) {
        if (!isUint128(x)) {
            throw MathError.overflow(name + " is not a uint128: " + x);
        }
        return x;
    }

    /**
     * Safe cast to int128.
     */
    public static BigInteger toInt128(BigInteger x) {
        if (!isInt128(x)) {
            throw MathError.overflow("value does not fit in int128: " + x);
        }
        return x;
    }

    /**
     * Reduces modulo 2^256 into [0, 2^256).
     */
    public static BigInteger wrap(BigInteger x) {
        return x.mod(TWO_POW_256);
    }

    public static BigInteger wrappingAdd(BigInteger a, BigInteger b) {
        return wrap(a.add(b));
    }

    public static BigInteger wrappingSub(BigInteger a, BigInteger b) {
        return wrap(a.subtract(b));
    }
}
