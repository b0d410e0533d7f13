// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.errors.MathError;

import java.math.BigInteger;

import static com.digitalasset.clmm.math.Uint256.MAX_UINT256;
import static com.digitalasset.clmm.math.Uint256.TWO_POW_256;

/**
 * Multiply-then-divide with a 512-bit intermediate and no loss of precision.
 *
 * Operands are unsigned 256-bit values. The quotient must itself fit in 256 bits.
 */
public final class FullMath {

    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final BigInteger THREE = BigInteger.valueOf(3);
    private static final int NEWTON_ITERATIONS = 6;

    private FullMath() {
    }

    /**
     * Computes {@code floor(a * b / denominator)}.
     *
     * @throws com.digitalasset.clmm.common.DomainException DIVISION_BY_ZERO when the
     *         denominator is zero, OVERFLOW when an operand or the result exceeds 256 bits
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        checkOperand(a, "a");
        checkOperand(b, "b");
        checkOperand(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw MathError.raise(MathError.Kind.DIVISION_BY_ZERO, "mulDiv denominator is zero");
        }

        // 512-bit product split into low and high words.
        BigInteger product = a.multiply(b);
        BigInteger prod0 = product.and(MAX_UINT256);
        BigInteger prod1 = product.shiftRight(256);

        if (prod1.signum() == 0) {
            return prod0.divide(denominator);
        }
        if (denominator.compareTo(prod1) <= 0) {
            throw MathError.overflow("mulDiv result exceeds 256 bits");
        }

        // Make the division exact by subtracting the remainder from [prod1 prod0].
        BigInteger remainder = product.mod(denominator);
        if (remainder.compareTo(prod0) > 0) {
            prod1 = prod1.subtract(BigInteger.ONE);
        }
        prod0 = Uint256.wrappingSub(prod0, remainder);

        // Factor the largest power of two out of the denominator.
        BigInteger twos = denominator.and(denominator.negate());
        BigInteger oddDenominator = denominator.divide(twos);
        prod0 = prod0.divide(twos);
        BigInteger flip = TWO_POW_256.divide(twos);
        prod0 = Uint256.wrap(prod0.or(prod1.multiply(flip)));

        // Inverse of the odd denominator mod 2^256, correct to 4 bits then doubled 6 times.
        BigInteger inverse = THREE.multiply(oddDenominator).xor(TWO);
        for (int i = 0; i < NEWTON_ITERATIONS; i++) {
            inverse = Uint256.wrap(inverse.multiply(TWO.subtract(oddDenominator.multiply(inverse))));
        }

        return Uint256.wrap(prod0.multiply(inverse));
    }

    /**
     * Computes {@code ceil(a * b / denominator)}.
     */
    public static BigInteger mulDivRoundingUp(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger result = mulDiv(a, b, denominator);
        if (a.multiply(b).mod(denominator).signum() > 0) {
            if (result.equals(MAX_UINT256)) {
                throw MathError.overflow("mulDivRoundingUp result exceeds 256 bits");
            }
            result = result.add(BigInteger.ONE);
        }
        return result;
    }

    /**
     * Computes {@code ceil(x / y)} for unsigned operands.
     */
    public static BigInteger divRoundingUp(BigInteger x, BigInteger y) {
        checkOperand(x, "x");
        checkOperand(y, "y");
        if (y.signum() == 0) {
            throw MathError.raise(MathError.Kind.DIVISION_BY_ZERO, "divRoundingUp divisor is zero");
        }
        BigInteger[] qr = x.divideAndRemainder(y);
        return qr[1].signum() > 0 ? qr[0].add(BigInteger.ONE) : qr[0];
    }

    private static void checkOperand(BigInteger value, String name) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be unsigned, got " + value);
        }
        if (value.bitLength() > 256) {
            throw MathError.overflow(name + " exceeds 256 bits");
        }
    }
}
