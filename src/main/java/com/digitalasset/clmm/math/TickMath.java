// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

/**
 * Conversion between tick indices and Q64.96 square-root prices, where
 * {@code sqrtPrice(tick) = sqrt(1.0001^tick) * 2^96}.
 *
 * Both directions are exact integer algorithms; no floating point is involved.
 */
public final class TickMath {

    public static final int MIN_TICK = -887272;
    public static final int MAX_TICK = 887272;

    public static final int MIN_TICK_SPACING = 1;
    public static final int MAX_TICK_SPACING = 32767;

    /** {@code getSqrtPriceAtTick(MIN_TICK)}. */
    public static final BigInteger MIN_SQRT_PRICE = new BigInteger("4295128739");
    /** {@code getSqrtPriceAtTick(MAX_TICK)}. */
    public static final BigInteger MAX_SQRT_PRICE =
        new BigInteger("1461446703485210103287273052203988822378723970342");

    // sqrt(1.0001^-(2^i)) in Q128.128 for i = 1..19; bit 0 seeds the ratio.
    private static final BigInteger ODD_TICK_RATIO = hex("fffcb933bd6fad37aa2d162d1a594001");
    private static final BigInteger[] BIT_RATIOS = {
        hex("fff97272373d413259a46990580e213a"),
        hex("fff2e50f5f656932ef12357cf3c7fdcc"),
        hex("ffe5caca7e10e4e61c3624eaa0941cd0"),
        hex("ffcb9843d60f6159c9db58835c926644"),
        hex("ff973b41fa98c081472e6896dfb254c0"),
        hex("ff2ea16466c96a3843ec78b326b52861"),
        hex("fe5dee046a99a2a811c461f1969c3053"),
        hex("fcbe86c7900a88aedcffc83b479aa3a4"),
        hex("f987a7253ac413176f2b074cf7815e54"),
        hex("f3392b0822b70005940c7a398e4b70f3"),
        hex("e7159475a2c29b7443b29c7fa6e889d9"),
        hex("d097f3bdfd2022b8845ad8f792aa5825"),
        hex("a9f746462d870fdf8a65dc1f90e061e5"),
        hex("70d869a156d2a1b890bb3df62baf32f7"),
        hex("31be135f97d08fd981231505542fcfa6"),
        hex("9aa508b5b7a84e1c677de54f3e99bc9"),
        hex("5d6af8dedb81196699c329225ee604"),
        hex("2216e584f5fa1ea926041bedfe98"),
        hex("48a170391f7dc42444e8fa2")
    };

    private static final BigInteger LOG_SQRT10001_MULTIPLIER = new BigInteger("255738958999603826347141");
    private static final BigInteger TICK_LOW_ERROR = new BigInteger("3402992956809132418596140100660247210");
    private static final BigInteger TICK_HIGH_ERROR = new BigInteger("291339464771989622907027621153398088495");
    private static final BigInteger LOW_32_BITS = BigInteger.ONE.shiftLeft(32).subtract(BigInteger.ONE);

    private TickMath() {
    }

    /**
     * Square-root price at the given tick, rounded up to Q64.96.
     *
     * @throws com.digitalasset.clmm.common.DomainException INVALID_TICK outside
     *         [MIN_TICK, MAX_TICK]
     */
    public static BigInteger getSqrtPriceAtTick(int tick) {
        if (tick < MIN_TICK || tick > MAX_TICK) {
            throw MathError.raise(MathError.Kind.INVALID_TICK, "tick " + tick + " outside ["
                + MIN_TICK + ", " + MAX_TICK + "]");
        }
        int absTick = Math.abs(tick);

        BigInteger ratio = (absTick & 0x1) != 0 ? ODD_TICK_RATIO : Uint256.TWO_POW_128;
        for (int bit = 1; bit < 20; bit++) {
            if ((absTick & (1 << bit)) != 0) {
                ratio = ratio.multiply(BIT_RATIOS[bit - 1]).shiftRight(128);
            }
        }

        if (tick > 0) {
            ratio = Uint256.MAX_UINT256.divide(ratio);
        }

        // Q128.128 -> Q64.96, rounding up.
        BigInteger sqrtPrice = ratio.shiftRight(32);
        if (ratio.and(LOW_32_BITS).signum() != 0) {
            sqrtPrice = sqrtPrice.add(BigInteger.ONE);
        }
        return sqrtPrice;
    }

    /**
     * Greatest tick whose square-root price is less than or equal to {@code sqrtPriceX96}.
     *
     * @throws com.digitalasset.clmm.common.DomainException INVALID_PRICE outside
     *         [MIN_SQRT_PRICE, MAX_SQRT_PRICE]
     */
    public static int getTickAtSqrtPrice(BigInteger sqrtPriceX96) {
        if (sqrtPriceX96.compareTo(MIN_SQRT_PRICE) < 0 || sqrtPriceX96.compareTo(MAX_SQRT_PRICE) > 0) {
            throw MathError.raise(MathError.Kind.INVALID_PRICE, "sqrtPriceX96 " + sqrtPriceX96
                + " outside [MIN_SQRT_PRICE, MAX_SQRT_PRICE]");
        }

        BigInteger ratio = sqrtPriceX96.shiftLeft(32);
        int msb = BitMath.mostSignificantBit(ratio);

        BigInteger r = msb >= 128 ? ratio.shiftRight(msb - 127) : ratio.shiftLeft(127 - msb);

        // Integer part of log2, then 14 fractional bits by repeated squaring.
        BigInteger log2 = BigInteger.valueOf(msb - 128).shiftLeft(64);
        for (int bit = 63; bit >= 50; bit--) {
            r = r.multiply(r).shiftRight(127);
            int f = r.shiftRight(128).intValue();
            if (f != 0) {
                log2 = log2.or(BigInteger.ONE.shiftLeft(bit));
                r = r.shiftRight(1);
            }
        }

        BigInteger logSqrt10001 = log2.multiply(LOG_SQRT10001_MULTIPLIER);

        int tickLow = logSqrt10001.subtract(TICK_LOW_ERROR).shiftRight(128).intValue();
        int tickHigh = logSqrt10001.add(TICK_HIGH_ERROR).shiftRight(128).intValue();

        if (tickLow == tickHigh) {
            return tickLow;
        }
        if (tickHigh <= MAX_TICK && getSqrtPriceAtTick(tickHigh).compareTo(sqrtPriceX96) <= 0) {
            return tickHigh;
        }
        return tickLow;
    }

    /**
     * Largest multiple of {@code tickSpacing} that is at most MAX_TICK.
     */
    public static int maxUsableTick(int tickSpacing) {
        return (MAX_TICK / tickSpacing) * tickSpacing;
    }

    /**
     * Smallest multiple of {@code tickSpacing} that is at least MIN_TICK.
     */
    public static int minUsableTick(int tickSpacing) {
        return (MIN_TICK / tickSpacing) * tickSpacing;
    }

    private static BigInteger hex(String digits) {
        return new BigInteger(digits, 16);
    }
}
