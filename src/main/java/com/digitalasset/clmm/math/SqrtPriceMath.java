// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

import static com.digitalasset.clmm.math.FixedPoint96.Q96;
import static com.digitalasset.clmm.math.FixedPoint96.RESOLUTION;

/**
 * Token amounts and price movements for a liquidity range, derived from
 * {@code x * y = L^2} with prices in Q64.96.
 *
 * Rounding always favors the pool: amounts the pool receives round up, amounts it pays
 * round down.
 */
public final class SqrtPriceMath {

    private SqrtPriceMath() {
    }

    /**
     * Next price after adding or removing {@code amount} of token0, rounded up.
     *
     * Uses {@code L * sqrtP / (L + amount * sqrtP)} when the intermediate fits in 256 bits,
     * else the equivalent {@code L / (L / sqrtP + amount)}.
     */
    public static BigInteger getNextSqrtPriceFromAmount0RoundingUp(
            BigInteger sqrtPX96, BigInteger liquidity, BigInteger amount, boolean add) {
        if (amount.signum() == 0) {
            return sqrtPX96;
        }
        BigInteger numerator1 = liquidity.shiftLeft(RESOLUTION);
        BigInteger product = amount.multiply(sqrtPX96);

        if (add) {
            if (Uint256.isUint256(product)) {
                BigInteger denominator = numerator1.add(product);
                if (Uint256.isUint256(denominator)) {
                    return FullMath.mulDivRoundingUp(numerator1, sqrtPX96, denominator);
                }
            }
            return FullMath.divRoundingUp(numerator1, numerator1.divide(sqrtPX96).add(amount));
        }

        if (!Uint256.isUint256(product) || numerator1.compareTo(product) <= 0) {
            throw MathError.raise(MathError.Kind.PRICE_OVERFLOW,
                "removing " + amount + " token0 exceeds the price range");
        }
        BigInteger denominator = numerator1.subtract(product);
        BigInteger next = FullMath.mulDivRoundingUp(numerator1, sqrtPX96, denominator);
        if (!Uint256.isUint160(next)) {
            throw MathError.raise(MathError.Kind.PRICE_OVERFLOW, "next sqrt price exceeds uint160");
        }
        return next;
    }

    /**
     * Next price after adding or removing {@code amount} of token1, rounded down.
     */
    public static BigInteger getNextSqrtPriceFromAmount1RoundingDown(
            BigInteger sqrtPX96, BigInteger liquidity, BigInteger amount, boolean add) {
        if (add) {
            BigInteger quotient = FullMath.mulDiv(amount, Q96, liquidity);
            BigInteger next = sqrtPX96.add(quotient);
            if (!Uint256.isUint160(next)) {
                throw MathError.raise(MathError.Kind.PRICE_OVERFLOW, "next sqrt price exceeds uint160");
            }
            return next;
        }

        BigInteger quotient = FullMath.mulDivRoundingUp(amount, Q96, liquidity);
        if (sqrtPX96.compareTo(quotient) <= 0) {
            throw MathError.raise(MathError.Kind.NOT_ENOUGH_LIQUIDITY,
                "removing " + amount + " token1 would drive the price to zero");
        }
        return sqrtPX96.subtract(quotient);
    }

    /**
     * Next price after an exact input amount of the token being sold.
     */
    public static BigInteger getNextSqrtPriceFromInput(
            BigInteger sqrtPX96, BigInteger liquidity, BigInteger amountIn, boolean zeroForOne) {
        requirePriceAndLiquidity(sqrtPX96, liquidity);
        return zeroForOne
            ? getNextSqrtPriceFromAmount0RoundingUp(sqrtPX96, liquidity, amountIn, true)
            : getNextSqrtPriceFromAmount1RoundingDown(sqrtPX96, liquidity, amountIn, true);
    }

    /**
     * Next price after an exact output amount of the token being bought.
     */
    public static BigInteger getNextSqrtPriceFromOutput(
            BigInteger sqrtPX96, BigInteger liquidity, BigInteger amountOut, boolean zeroForOne) {
        requirePriceAndLiquidity(sqrtPX96, liquidity);
        return zeroForOne
            ? getNextSqrtPriceFromAmount1RoundingDown(sqrtPX96, liquidity, amountOut, false)
            : getNextSqrtPriceFromAmount0RoundingUp(sqrtPX96, liquidity, amountOut, false);
    }

    /**
     * Token0 needed to move between two prices: {@code L * (sqrtB - sqrtA) / (sqrtA * sqrtB)}.
     */
    public static BigInteger getAmount0Delta(
            BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96, BigInteger liquidity, boolean roundUp) {
        BigInteger lower = sqrtPriceAX96.min(sqrtPriceBX96);
        BigInteger upper = sqrtPriceAX96.max(sqrtPriceBX96);
        requireNonZeroLower(lower);

        BigInteger numerator1 = liquidity.shiftLeft(RESOLUTION);
        BigInteger numerator2 = upper.subtract(lower);

        if (roundUp) {
            return FullMath.divRoundingUp(FullMath.mulDivRoundingUp(numerator1, numerator2, upper), lower);
        }
        return FullMath.mulDiv(numerator1, numerator2, upper).divide(lower);
    }

    /**
     * Token1 needed to move between two prices: {@code L * (sqrtB - sqrtA)}.
     */
    public static BigInteger getAmount1Delta(
            BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96, BigInteger liquidity, boolean roundUp) {
        BigInteger lower = sqrtPriceAX96.min(sqrtPriceBX96);
        BigInteger upper = sqrtPriceAX96.max(sqrtPriceBX96);
        requireNonZeroLower(lower);

        BigInteger diff = upper.subtract(lower);
        return roundUp
            ? FullMath.mulDivRoundingUp(liquidity, diff, Q96)
            : FullMath.mulDiv(liquidity, diff, Q96);
    }

    /**
     * Signed token0 delta for a signed liquidity change, seen from the caller: adding
     * liquidity yields a negative amount rounded up in magnitude, removing yields a positive
     * amount rounded down.
     */
    public static BigInteger getAmount0Delta(
            BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96, BigInteger liquidityDelta) {
        if (liquidityDelta.signum() < 0) {
            return getAmount0Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta.negate(), false);
        }
        return getAmount0Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta, true).negate();
    }

    /**
     * Signed token1 delta for a signed liquidity change, with the same sign convention as
     * {@link #getAmount0Delta(BigInteger, BigInteger, BigInteger)}.
     */
    public static BigInteger getAmount1Delta(
            BigInteger sqrtPriceAX96, BigInteger sqrtPriceBX96, BigInteger liquidityDelta) {
        if (liquidityDelta.signum() < 0) {
            return getAmount1Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta.negate(), false);
        }
        return getAmount1Delta(sqrtPriceAX96, sqrtPriceBX96, liquidityDelta, true).negate();
    }

    private static void requirePriceAndLiquidity(BigInteger sqrtPX96, BigInteger liquidity) {
        if (sqrtPX96.signum() <= 0) {
            throw MathError.raise(MathError.Kind.INVALID_PRICE, "sqrt price must be positive");
        }
        if (liquidity.signum() <= 0) {
            throw MathError.raise(MathError.Kind.INVALID_LIQUIDITY, "liquidity must be positive");
        }
    }

    private static void requireNonZeroLower(BigInteger lower) {
        if (lower.signum() <= 0) {
            throw MathError.raise(MathError.Kind.INVALID_PRICE, "lower sqrt price must be positive");
        }
    }
}
