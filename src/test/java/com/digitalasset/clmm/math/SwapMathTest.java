// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import com.digitalasset.clmm.common.DomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static com.digitalasset.clmm.math.FixedPoint96.Q96;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SwapMath Tests")
class SwapMathTest {

    private static final BigInteger LIQUIDITY = BigInteger.TEN.pow(18);
    private static final BigInteger AMOUNT = BigInteger.TEN.pow(15);

    @Test
    @DisplayName("Exact input that stays inside the segment consumes the whole amount")
    void testExactInputWithinSegment() {
        // Arrange
        BigInteger target = TickMath.getSqrtPriceAtTick(-600);

        // Act
        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, target, LIQUIDITY, AMOUNT.negate(), 3000);

        // Assert
        assertEquals(new BigInteger("79149250711305166342700278159"), step.sqrtPriceNextX96());
        assertEquals(new BigInteger("997000000000000"), step.amountIn());
        assertEquals(new BigInteger("996006981039903"), step.amountOut());
        assertEquals(new BigInteger("3000000000000"), step.feeAmount());
        assertEquals(AMOUNT, step.amountIn().add(step.feeAmount()), "input plus fee must equal the amount");
    }

    @Test
    @DisplayName("Exact output that stays inside the segment produces the whole amount")
    void testExactOutputWithinSegment() {
        // Arrange
        BigInteger target = TickMath.getSqrtPriceAtTick(600);

        // Act
        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, target, LIQUIDITY, AMOUNT, 3000);

        // Assert
        assertEquals(new BigInteger("79307469984248586179723674011"), step.sqrtPriceNextX96());
        assertEquals(new BigInteger("1001001001001002"), step.amountIn());
        assertEquals(AMOUNT, step.amountOut());
        assertEquals(new BigInteger("3012039120365"), step.feeAmount());
    }

    @Test
    @DisplayName("Exact input larger than the segment stops at the target")
    void testExactInputCappedAtTarget() {
        BigInteger target = TickMath.getSqrtPriceAtTick(-600);
        BigInteger available = BigInteger.TEN.pow(30);

        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, target, LIQUIDITY, available.negate(), 3000);

        assertEquals(target, step.sqrtPriceNextX96());
        assertTrue(step.amountIn().add(step.feeAmount()).compareTo(available) < 0);
        assertEquals(SqrtPriceMath.getAmount0Delta(target, Q96, LIQUIDITY, true), step.amountIn());
    }

    @Test
    @DisplayName("Exact output larger than the segment stops at the target")
    void testExactOutputCappedAtTarget() {
        BigInteger target = TickMath.getSqrtPriceAtTick(600);

        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, target, LIQUIDITY, BigInteger.TEN.pow(30), 3000);

        assertEquals(target, step.sqrtPriceNextX96());
        assertEquals(SqrtPriceMath.getAmount0Delta(Q96, target, LIQUIDITY, false), step.amountOut());
    }

    @Test
    @DisplayName("A tiny input can be taken entirely as input and fee without moving the price")
    void testTinyInputDoesNotMovePrice() {
        SwapMath.StepResult step = SwapMath.computeSwapStep(
            BigInteger.valueOf(2413),
            new BigInteger("79887613182836312"),
            new BigInteger("1985041575832132834610021537970"),
            BigInteger.valueOf(-10),
            1872);

        assertEquals(BigInteger.valueOf(2413), step.sqrtPriceNextX96());
        assertEquals(BigInteger.valueOf(9), step.amountIn());
        assertEquals(BigInteger.ZERO, step.amountOut());
        assertEquals(BigInteger.ONE, step.feeAmount());
    }

    @Test
    @DisplayName("A 100% fee takes the whole input as fee")
    void testFullFee() {
        BigInteger target = TickMath.getSqrtPriceAtTick(-600);

        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, target, LIQUIDITY, AMOUNT.negate(), SwapMath.MAX_SWAP_FEE);

        assertEquals(Q96, step.sqrtPriceNextX96());
        assertEquals(BigInteger.ZERO, step.amountIn());
        assertEquals(BigInteger.ZERO, step.amountOut());
        assertEquals(AMOUNT, step.feeAmount());
    }

    @Test
    @DisplayName("Zero fee charges nothing")
    void testZeroFee() {
        SwapMath.StepResult step = SwapMath.computeSwapStep(Q96, TickMath.getSqrtPriceAtTick(-600),
            LIQUIDITY, AMOUNT.negate(), 0);

        assertEquals(BigInteger.ZERO, step.feeAmount());
        assertEquals(AMOUNT, step.amountIn());
    }

    @Test
    @DisplayName("Invalid fee and empty liquidity are rejected")
    void testRejectedInputs() {
        BigInteger target = TickMath.getSqrtPriceAtTick(-600);

        DomainException fee = assertThrows(DomainException.class,
            () -> SwapMath.computeSwapStep(Q96, target, LIQUIDITY, AMOUNT.negate(), SwapMath.MAX_SWAP_FEE + 1));
        DomainException liquidity = assertThrows(DomainException.class,
            () -> SwapMath.computeSwapStep(Q96, target, BigInteger.ZERO, AMOUNT.negate(), 3000));

        assertEquals("INVALID_PRICE", fee.code());
        assertEquals("NOT_ENOUGH_LIQUIDITY", liquidity.code());
    }

    @Test
    @DisplayName("Price target is the next tick capped by the limit")
    void testSqrtPriceTarget() {
        BigInteger next = BigInteger.valueOf(100);
        BigInteger limit = BigInteger.valueOf(200);

        assertEquals(limit, SwapMath.getSqrtPriceTarget(true, next, limit));
        assertEquals(next, SwapMath.getSqrtPriceTarget(false, next, limit));
        assertEquals(limit, SwapMath.getSqrtPriceTarget(false, BigInteger.valueOf(300), limit));
    }

    @Test
    @DisplayName("Random steps never go negative, overshoot the target or exceed the amount")
    void testRandomStepsHoldInvariants() {
        Random random = new Random(42);
        for (int i = 0; i < 2000; i++) {
            // Arrange
            int currentTick = random.nextInt(200_001) - 100_000;
            int targetTick = random.nextInt(200_001) - 100_000;
            if (targetTick == currentTick) {
                targetTick++;
            }
            BigInteger current = TickMath.getSqrtPriceAtTick(currentTick);
            BigInteger target = TickMath.getSqrtPriceAtTick(targetTick);
            BigInteger liquidity = new BigInteger(1 + random.nextInt(100), random).max(BigInteger.ONE);
            BigInteger magnitude = new BigInteger(1 + random.nextInt(90), random).max(BigInteger.ONE);
            boolean exactInput = random.nextBoolean();
            BigInteger amountRemaining = exactInput ? magnitude.negate() : magnitude;
            int fee = random.nextInt(100_000);
            String context = "step " + i + " [" + currentTick + " -> " + targetTick + ", L=" + liquidity
                + ", amount=" + amountRemaining + ", fee=" + fee + "]";

            // Act
            SwapMath.StepResult step = SwapMath.computeSwapStep(current, target, liquidity, amountRemaining, fee);

            // Assert
            assertTrue(step.amountIn().signum() >= 0, context);
            assertTrue(step.amountOut().signum() >= 0, context);
            assertTrue(step.feeAmount().signum() >= 0, context);

            BigInteger low = current.min(target);
            BigInteger high = current.max(target);
            BigInteger next = step.sqrtPriceNextX96();
            assertTrue(next.compareTo(low) >= 0 && next.compareTo(high) <= 0, context + ": price " + next);

            if (exactInput) {
                BigInteger spent = step.amountIn().add(step.feeAmount());
                assertTrue(spent.compareTo(magnitude) <= 0, context + ": spent " + spent);
                if (!next.equals(target)) {
                    assertEquals(magnitude, spent, context + ": partial step must use the whole amount");
                }
            } else {
                assertTrue(step.amountOut().compareTo(magnitude) <= 0, context + ": received " + step.amountOut());
            }
        }
    }
}
