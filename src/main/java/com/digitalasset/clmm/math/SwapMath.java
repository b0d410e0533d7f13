// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

/**
 * A single step of a swap within one liquidity segment.
 */
public final class SwapMath {

    /** Fee denominator: fees are in hundredths of a basis point, so 1e6 is 100%. */
    public static final int MAX_SWAP_FEE = 1_000_000;

    private static final BigInteger MAX_SWAP_FEE_BIG = BigInteger.valueOf(MAX_SWAP_FEE);

    private SwapMath() {
    }

    /**
     * Outcome of one swap step. All amounts are unsigned.
     */
    public record StepResult(BigInteger sqrtPriceNextX96, BigInteger amountIn,
                             BigInteger amountOut, BigInteger feeAmount) {
    }

    /**
     * The price a step should move towards: the next tick price, capped by the caller's
     * limit in the direction of travel.
     */
    public static BigInteger getSqrtPriceTarget(boolean zeroForOne, BigInteger sqrtPriceNextX96,
                                                BigInteger sqrtPriceLimitX96) {
        return zeroForOne
            ? sqrtPriceNextX96.max(sqrtPriceLimitX96)
            : sqrtPriceNextX96.min(sqrtPriceLimitX96);
    }

    /**
     * Swaps as far as possible from the current price towards the target.
     *
     * @param amountRemaining negative for exact input, non-negative for exact output
     * @param feePips         fee in hundredths of a basis point
     */
    public static StepResult computeSwapStep(BigInteger sqrtPriceCurrentX96, BigInteger sqrtPriceTargetX96,
                                             BigInteger liquidity, BigInteger amountRemaining, int feePips) {
        if (feePips < 0 || feePips > MAX_SWAP_FEE) {
            throw MathError.raise(MathError.Kind.INVALID_PRICE, "fee " + feePips + " exceeds " + MAX_SWAP_FEE);
        }
        if (liquidity.signum() <= 0) {
            throw MathError.raise(MathError.Kind.NOT_ENOUGH_LIQUIDITY, "swap step requires liquidity");
        }

        BigInteger fee = BigInteger.valueOf(feePips);
        BigInteger feeComplement = MAX_SWAP_FEE_BIG.subtract(fee);
        boolean zeroForOne = sqrtPriceCurrentX96.compareTo(sqrtPriceTargetX96) >= 0;
        boolean exactIn = amountRemaining.signum() < 0;

        BigInteger sqrtPriceNextX96;
        BigInteger amountIn;
        BigInteger amountOut;
        BigInteger feeAmount;

        if (exactIn) {
            BigInteger available = amountRemaining.negate();
            BigInteger amountRemainingLessFee = FullMath.mulDiv(available, feeComplement, MAX_SWAP_FEE_BIG);
            amountIn = zeroForOne
                ? SqrtPriceMath.getAmount0Delta(sqrtPriceTargetX96, sqrtPriceCurrentX96, liquidity, true)
                : SqrtPriceMath.getAmount1Delta(sqrtPriceCurrentX96, sqrtPriceTargetX96, liquidity, true);
            if (amountRemainingLessFee.compareTo(amountIn) >= 0) {
                sqrtPriceNextX96 = sqrtPriceTargetX96;
                feeAmount = feePips == MAX_SWAP_FEE
                    ? amountIn
                    : FullMath.mulDivRoundingUp(amountIn, fee, feeComplement);
            } else {
                amountIn = amountRemainingLessFee;
                sqrtPriceNextX96 = SqrtPriceMath.getNextSqrtPriceFromInput(
                    sqrtPriceCurrentX96, liquidity, amountRemainingLessFee, zeroForOne);
                feeAmount = available.subtract(amountIn);
            }
            amountOut = zeroForOne
                ? SqrtPriceMath.getAmount1Delta(sqrtPriceNextX96, sqrtPriceCurrentX96, liquidity, false)
                : SqrtPriceMath.getAmount0Delta(sqrtPriceCurrentX96, sqrtPriceNextX96, liquidity, false);
        } else {
            amountOut = zeroForOne
                ? SqrtPriceMath.getAmount1Delta(sqrtPriceTargetX96, sqrtPriceCurrentX96, liquidity, false)
                : SqrtPriceMath.getAmount0Delta(sqrtPriceCurrentX96, sqrtPriceTargetX96, liquidity, false);
            if (amountRemaining.compareTo(amountOut) >= 0) {
                sqrtPriceNextX96 = sqrtPriceTargetX96;
            } else {
                amountOut = amountRemaining;
                sqrtPriceNextX96 = SqrtPriceMath.getNextSqrtPriceFromOutput(
                    sqrtPriceCurrentX96, liquidity, amountOut, zeroForOne);
            }
            amountIn = zeroForOne
                ? SqrtPriceMath.getAmount0Delta(sqrtPriceNextX96, sqrtPriceCurrentX96, liquidity, true)
                : SqrtPriceMath.getAmount1Delta(sqrtPriceCurrentX96, sqrtPriceNextX96, liquidity, true);
            // Exact output at a 100% fee is rejected by the pool before reaching here.
            feeAmount = FullMath.mulDivRoundingUp(amountIn, fee, feeComplement);
        }

        return new StepResult(sqrtPriceNextX96, amountIn, amountOut, feeAmount);
    }
}
