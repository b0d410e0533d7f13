// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import com.digitalasset.clmm.common.DomainException;
import com.digitalasset.clmm.common.errors.PoolStateError;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.fees.ProtocolFeeLibrary;
import com.digitalasset.clmm.math.FixedPoint128;
import com.digitalasset.clmm.math.FullMath;
import com.digitalasset.clmm.math.LiquidityMath;
import com.digitalasset.clmm.math.SqrtPriceMath;
import com.digitalasset.clmm.math.SwapMath;
import com.digitalasset.clmm.math.TickMath;
import com.digitalasset.clmm.math.Uint256;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.Salt;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Concentrated-liquidity pool state machine: {@code Uninitialized -> Initialized}.
 *
 * Every operation is all-or-nothing. A failure leaves the pool exactly as it was before the
 * call. Instances are not thread-safe; the owner must serialize access.
 */
public class Pool {

    private Slot0 slot0 = Slot0.UNINITIALIZED;
    private BigInteger feeGrowthGlobal0X128 = BigInteger.ZERO;
    private BigInteger feeGrowthGlobal1X128 = BigInteger.ZERO;
    private BigInteger liquidity = BigInteger.ZERO;

    private final TickManager tickManager = new TickManager();
    private final PositionManager positionManager = new PositionManager();

    /**
     * Sets the starting price.
     *
     * @return the tick at that price
     */
    public int initialize(BigInteger sqrtPriceX96, int lpFee) {
        if (slot0.isInitialized()) {
            throw PoolStateError.raise(PoolStateError.Kind.POOL_ALREADY_INITIALIZED, "pool is already initialized");
        }
        if (sqrtPriceX96.compareTo(TickMath.MIN_SQRT_PRICE) < 0 || sqrtPriceX96.compareTo(TickMath.MAX_SQRT_PRICE) > 0) {
            throw PoolStateError.raise(PoolStateError.Kind.INVALID_PRICE,
                "initial sqrt price " + sqrtPriceX96 + " is outside the supported range");
        }
        LpFeeLibrary.validate(lpFee);

        int tick = TickMath.getTickAtSqrtPrice(sqrtPriceX96);
        slot0 = new Slot0(sqrtPriceX96, tick, 0, lpFee);
        return tick;
    }

    public void setProtocolFee(int protocolFee) {
        requireInitialized();
        if (!ProtocolFeeLibrary.isValid(protocolFee)) {
            throw PoolStateError.raise(PoolStateError.Kind.PROTOCOL_FEE_TOO_LARGE,
                "protocol fee " + Integer.toHexString(protocolFee) + " exceeds " + ProtocolFeeLibrary.MAX_PROTOCOL_FEE);
        }
        slot0 = slot0.withProtocolFee(protocolFee);
    }

    public void setLpFee(int lpFee) {
        requireInitialized();
        LpFeeLibrary.validate(lpFee);
        slot0 = slot0.withLpFee(lpFee);
    }

    /**
     * Adds ({@code liquidityDelta > 0}) or removes liquidity over {@code [tickLower, tickUpper)}
     * and settles the position's accrued fees. A zero delta only collects fees.
     */
    public ModifyLiquidityResult modifyPosition(Address owner, int tickLower, int tickUpper,
                                                BigInteger liquidityDelta, int tickSpacing, Salt salt) {
        requireInitialized();
        checkTicks(tickLower, tickUpper, tickSpacing);
        Uint256.toInt128(liquidityDelta);

        PositionKey key = new PositionKey(owner, tickLower, tickUpper, salt);
        positionManager.checkUpdate(key, liquidityDelta);

        Slot0 current = slot0;
        int tick = current.tick();
        boolean inRange = tick >= tickLower && tick < tickUpper;

        // Everything that depends only on the current state is computed before any mutation.
        BalanceDelta principal = BalanceDelta.ZERO;
        BigInteger liquidityAfter = liquidity;
        if (liquidityDelta.signum() != 0) {
            BigInteger sqrtPriceLower = TickMath.getSqrtPriceAtTick(tickLower);
            BigInteger sqrtPriceUpper = TickMath.getSqrtPriceAtTick(tickUpper);
            if (tick < tickLower) {
                principal = new BalanceDelta(
                    SqrtPriceMath.getAmount0Delta(sqrtPriceLower, sqrtPriceUpper, liquidityDelta),
                    BigInteger.ZERO);
            } else if (tick < tickUpper) {
                principal = new BalanceDelta(
                    SqrtPriceMath.getAmount0Delta(current.sqrtPriceX96(), sqrtPriceUpper, liquidityDelta),
                    SqrtPriceMath.getAmount1Delta(sqrtPriceLower, current.sqrtPriceX96(), liquidityDelta));
                liquidityAfter = LiquidityMath.addDelta(liquidity, liquidityDelta);
            } else {
                principal = new BalanceDelta(
                    BigInteger.ZERO,
                    SqrtPriceMath.getAmount1Delta(sqrtPriceLower, sqrtPriceUpper, liquidityDelta));
            }
        }

        TickManager.Checkpoint checkpoint = tickManager.checkpoint(tickSpacing, tickLower, tickUpper);
        Optional<Position> priorPosition = positionManager.get(key);
        boolean flippedLower = false;
        boolean flippedUpper = false;
        BalanceDelta feeDelta;
        BalanceDelta callerDelta;
        try {
            if (liquidityDelta.signum() != 0) {
                BigInteger maxLiquidityPerTick = tickSpacingToMaxLiquidityPerTick(tickSpacing);

                TickManager.TickUpdate lower = tickManager.updateTick(tickLower, liquidityDelta,
                    feeGrowthGlobal0X128, feeGrowthGlobal1X128, false, tick, tickSpacing);
                checkMaxLiquidity(tickLower, liquidityDelta, lower, maxLiquidityPerTick);

                TickManager.TickUpdate upper = tickManager.updateTick(tickUpper, liquidityDelta,
                    feeGrowthGlobal0X128, feeGrowthGlobal1X128, true, tick, tickSpacing);
                checkMaxLiquidity(tickUpper, liquidityDelta, upper, maxLiquidityPerTick);

                flippedLower = lower.flipped();
                flippedUpper = upper.flipped();
            }

            TickManager.FeeGrowthInside inside = tickManager.getFeeGrowthInside(
                tickLower, tickUpper, tick, feeGrowthGlobal0X128, feeGrowthGlobal1X128);
            feeDelta = positionManager.update(key, liquidityDelta,
                inside.feeGrowthInside0X128(), inside.feeGrowthInside1X128());
            callerDelta = principal.add(feeDelta);
        } catch (DomainException e) {
            tickManager.restore(checkpoint);
            positionManager.restore(key, priorPosition);
            throw e;
        }

        // Ticks that lost their last reference are cleared once fees have been read from them.
        if (liquidityDelta.signum() < 0) {
            if (flippedLower) {
                tickManager.clearTick(tickLower, tickSpacing);
            }
            if (flippedUpper) {
                tickManager.clearTick(tickUpper, tickSpacing);
            }
        }
        if (inRange) {
            liquidity = liquidityAfter;
        }

        return new ModifyLiquidityResult(principal, feeDelta, callerDelta);
    }

    /**
     * Swaps against the pool until {@code amountSpecified} is consumed or the price reaches
     * {@code sqrtPriceLimitX96}.
     *
     * @param amountSpecified negative for exact input, positive for exact output
     * @param lpFeeOverride   LP fee to use instead of the pool's own, if present
     */
    public SwapResult swap(BigInteger amountSpecified, BigInteger sqrtPriceLimitX96, boolean zeroForOne,
                           int tickSpacing, OptionalInt lpFeeOverride) {
        requireInitialized();
        Slot0 start = slot0;

        int protocolFee = zeroForOne
            ? ProtocolFeeLibrary.getZeroForOneFee(start.protocolFee())
            : ProtocolFeeLibrary.getOneForZeroFee(start.protocolFee());

        int lpFee = start.lpFee();
        if (lpFeeOverride.isPresent()) {
            lpFee = lpFeeOverride.getAsInt();
            LpFeeLibrary.validate(lpFee);
        }
        int swapFee = protocolFee == 0 ? lpFee : ProtocolFeeLibrary.calculateSwapFee(protocolFee, lpFee);

        // A 100% fee consumes the whole input, so no output could ever be produced.
        if (swapFee >= SwapMath.MAX_SWAP_FEE && amountSpecified.signum() > 0) {
            throw PoolStateError.raise(PoolStateError.Kind.INVALID_FEE_FOR_EXACT_OUT,
                "exact output swaps are impossible at a fee of " + swapFee);
        }

        if (amountSpecified.signum() == 0) {
            return new SwapResult(BalanceDelta.ZERO, BigInteger.ZERO, swapFee,
                start.sqrtPriceX96(), start.tick(), liquidity, 0);
        }
        checkPriceLimit(start.sqrtPriceX96(), sqrtPriceLimitX96, zeroForOne);

        boolean exactInput = amountSpecified.signum() < 0;
        BigInteger amountRemaining = amountSpecified;
        BigInteger amountCalculated = BigInteger.ZERO;
        BigInteger amountToProtocol = BigInteger.ZERO;

        BigInteger sqrtPrice = start.sqrtPriceX96();
        int tick = start.tick();
        BigInteger activeLiquidity = liquidity;
        BigInteger feeGrowthGlobalX128 = zeroForOne ? feeGrowthGlobal0X128 : feeGrowthGlobal1X128;
        List<TickCrossing> crossings = new ArrayList<>();
        BigInteger protocolFeeBig = BigInteger.valueOf(protocolFee);
        BigInteger pips = BigInteger.valueOf(ProtocolFeeLibrary.PIPS_DENOMINATOR);

        while (amountRemaining.signum() != 0 && !sqrtPrice.equals(sqrtPriceLimitX96)) {
            BigInteger stepStart = sqrtPrice;
            TickManager.NextTick next = tickManager.nextInitializedTickWithinOneWord(tick, tickSpacing, zeroForOne);
            int tickNext = Math.max(TickMath.MIN_TICK, Math.min(TickMath.MAX_TICK, next.tick()));
            BigInteger sqrtPriceNext = TickMath.getSqrtPriceAtTick(tickNext);
            BigInteger target = SwapMath.getSqrtPriceTarget(zeroForOne, sqrtPriceNext, sqrtPriceLimitX96);

            SwapMath.StepResult step;
            if (activeLiquidity.signum() == 0) {
                // Empty segment: the price moves freely to the target.
                step = new SwapMath.StepResult(target, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
            } else {
                step = SwapMath.computeSwapStep(sqrtPrice, target, activeLiquidity, amountRemaining, swapFee);
            }
            sqrtPrice = step.sqrtPriceNextX96();

            BigInteger inPlusFee = step.amountIn().add(step.feeAmount());
            if (exactInput) {
                amountRemaining = amountRemaining.add(inPlusFee);
                amountCalculated = amountCalculated.add(step.amountOut());
            } else {
                amountRemaining = amountRemaining.subtract(step.amountOut());
                amountCalculated = amountCalculated.subtract(inPlusFee);
            }

            BigInteger lpFeeAmount = step.feeAmount();
            if (protocolFee > 0) {
                BigInteger protocolShare = swapFee == protocolFee
                    ? step.feeAmount()
                    : inPlusFee.multiply(protocolFeeBig).divide(pips);
                lpFeeAmount = lpFeeAmount.subtract(protocolShare);
                amountToProtocol = amountToProtocol.add(protocolShare);
            }

            if (activeLiquidity.signum() > 0) {
                feeGrowthGlobalX128 = Uint256.wrappingAdd(feeGrowthGlobalX128,
                    FullMath.mulDiv(lpFeeAmount, FixedPoint128.Q128, activeLiquidity));
            }

            if (sqrtPrice.equals(sqrtPriceNext)) {
                if (next.initialized()) {
                    BigInteger global0 = zeroForOne ? feeGrowthGlobalX128 : feeGrowthGlobal0X128;
                    BigInteger global1 = zeroForOne ? feeGrowthGlobal1X128 : feeGrowthGlobalX128;
                    crossings.add(new TickCrossing(tickNext, global0, global1));

                    BigInteger liquidityNet = tickManager.getTick(tickNext)
                        .map(TickInfo::liquidityNet)
                        .orElse(BigInteger.ZERO);
                    if (zeroForOne) {
                        liquidityNet = liquidityNet.negate();
                    }
                    activeLiquidity = LiquidityMath.addDelta(activeLiquidity, liquidityNet);
                }
                // A zero-for-one crossing leaves the price on tickNext but the tick below it.
                tick = zeroForOne ? tickNext - 1 : tickNext;
            } else if (!sqrtPrice.equals(stepStart)) {
                tick = TickMath.getTickAtSqrtPrice(sqrtPrice);
            }
        }

        BigInteger amountSpecifiedUsed = amountSpecified.subtract(amountRemaining);
        BalanceDelta delta = zeroForOne != exactInput
            ? new BalanceDelta(amountCalculated, amountSpecifiedUsed)
            : new BalanceDelta(amountSpecifiedUsed, amountCalculated);

        // Commit.
        for (TickCrossing crossing : crossings) {
            tickManager.crossTick(crossing.tick(), crossing.feeGrowthGlobal0X128(), crossing.feeGrowthGlobal1X128());
        }
        slot0 = start.withPrice(sqrtPrice, tick);
        liquidity = activeLiquidity;
        if (zeroForOne) {
            feeGrowthGlobal0X128 = feeGrowthGlobalX128;
        } else {
            feeGrowthGlobal1X128 = feeGrowthGlobalX128;
        }

        return new SwapResult(delta, amountToProtocol, swapFee, sqrtPrice, tick, activeLiquidity, crossings.size());
    }

    /**
     * Pays {@code amount0} and {@code amount1} to in-range liquidity providers.
     *
     * @return the donor's delta, {@code (-amount0, -amount1)}
     */
    public BalanceDelta donate(BigInteger amount0, BigInteger amount1) {
        requireInitialized();
        if (liquidity.signum() == 0) {
            throw PoolStateError.raise(PoolStateError.Kind.NO_LIQUIDITY_TO_RECEIVE_FEES,
                "no in-range liquidity to receive the donation");
        }
        Uint256.requireUint128(amount0, "amount0");
        Uint256.requireUint128(amount1, "amount1");
        BalanceDelta delta = new BalanceDelta(amount0.negate(), amount1.negate());

        if (amount0.signum() > 0) {
            feeGrowthGlobal0X128 = Uint256.wrappingAdd(feeGrowthGlobal0X128,
                FullMath.mulDiv(amount0, FixedPoint128.Q128, liquidity));
        }
        if (amount1.signum() > 0) {
            feeGrowthGlobal1X128 = Uint256.wrappingAdd(feeGrowthGlobal1X128,
                FullMath.mulDiv(amount1, FixedPoint128.Q128, liquidity));
        }
        return delta;
    }

    /**
     * Upper bound on the gross liquidity of a single tick, so that liquidity summed over every
     * usable tick cannot overflow uint128.
     */
    public static BigInteger tickSpacingToMaxLiquidityPerTick(int tickSpacing) {
        int minTick = Math.floorDiv(TickMath.MIN_TICK, tickSpacing);
        int maxTick = TickMath.MAX_TICK / tickSpacing;
        long numTicks = (long) maxTick - minTick + 1;
        return Uint256.MAX_UINT128.divide(BigInteger.valueOf(numTicks));
    }

    /**
     * Captures the full pool state so that an operation spanning several calls can be undone.
     */
    public Snapshot snapshot() {
        return new Snapshot(slot0, feeGrowthGlobal0X128, feeGrowthGlobal1X128, liquidity,
            tickManager.checkpointAll(), positionManager.snapshot());
    }

    public void restore(Snapshot snapshot) {
        slot0 = snapshot.slot0();
        feeGrowthGlobal0X128 = snapshot.feeGrowthGlobal0X128();
        feeGrowthGlobal1X128 = snapshot.feeGrowthGlobal1X128();
        liquidity = snapshot.liquidity();
        tickManager.restore(snapshot.ticks());
        positionManager.restoreAll(snapshot.positions());
    }

    public Slot0 slot0() {
        return slot0;
    }

    public boolean isInitialized() {
        return slot0.isInitialized();
    }

    public BigInteger liquidity() {
        return liquidity;
    }

    public BigInteger feeGrowthGlobal0X128() {
        return feeGrowthGlobal0X128;
    }

    public BigInteger feeGrowthGlobal1X128() {
        return feeGrowthGlobal1X128;
    }

    public TickReader ticks() {
        return tickManager;
    }

    public Optional<Position> position(PositionKey key) {
        return positionManager.get(key);
    }

    public int positionCount() {
        return positionManager.size();
    }

    private void requireInitialized() {
        if (!slot0.isInitialized()) {
            throw PoolStateError.raise(PoolStateError.Kind.POOL_NOT_INITIALIZED, "pool is not initialized");
        }
    }

    private static void checkTicks(int tickLower, int tickUpper, int tickSpacing) {
        if (tickLower >= tickUpper) {
            throw PoolStateError.raise(PoolStateError.Kind.TICKS_MISORDERED,
                "tickLower " + tickLower + " must be below tickUpper " + tickUpper);
        }
        if (tickLower < TickMath.MIN_TICK) {
            throw PoolStateError.raise(PoolStateError.Kind.TICK_LOWER_OUT_OF_BOUNDS,
                "tickLower " + tickLower + " is below " + TickMath.MIN_TICK);
        }
        if (tickUpper > TickMath.MAX_TICK) {
            throw PoolStateError.raise(PoolStateError.Kind.TICK_UPPER_OUT_OF_BOUNDS,
                "tickUpper " + tickUpper + " is above " + TickMath.MAX_TICK);
        }
        if (tickLower % tickSpacing != 0 || tickUpper % tickSpacing != 0) {
            throw PoolStateError.raise(PoolStateError.Kind.TICK_MISALIGNED,
                "ticks [" + tickLower + ", " + tickUpper + "] are not multiples of spacing " + tickSpacing);
        }
    }

    private static void checkMaxLiquidity(int tick, BigInteger liquidityDelta, TickManager.TickUpdate update,
                                          BigInteger maxLiquidityPerTick) {
        if (liquidityDelta.signum() > 0 && update.liquidityGrossAfter().compareTo(maxLiquidityPerTick) > 0) {
            throw PoolStateError.tickLiquidityOverflow(tick);
        }
    }

    private static void checkPriceLimit(BigInteger sqrtPriceX96, BigInteger sqrtPriceLimitX96, boolean zeroForOne) {
        if (zeroForOne) {
            if (sqrtPriceLimitX96.compareTo(sqrtPriceX96) >= 0) {
                throw PoolStateError.raise(PoolStateError.Kind.PRICE_LIMIT_ALREADY_EXCEEDED,
                    "limit " + sqrtPriceLimitX96 + " is not below the current price " + sqrtPriceX96);
            }
            if (sqrtPriceLimitX96.compareTo(TickMath.MIN_SQRT_PRICE) <= 0) {
                throw PoolStateError.raise(PoolStateError.Kind.PRICE_LIMIT_OUT_OF_BOUNDS,
                    "limit " + sqrtPriceLimitX96 + " is at or below MIN_SQRT_PRICE");
            }
        } else {
            if (sqrtPriceLimitX96.compareTo(sqrtPriceX96) <= 0) {
                throw PoolStateError.raise(PoolStateError.Kind.PRICE_LIMIT_ALREADY_EXCEEDED,
                    "limit " + sqrtPriceLimitX96 + " is not above the current price " + sqrtPriceX96);
            }
            if (sqrtPriceLimitX96.compareTo(TickMath.MAX_SQRT_PRICE) >= 0) {
                throw PoolStateError.raise(PoolStateError.Kind.PRICE_LIMIT_OUT_OF_BOUNDS,
                    "limit " + sqrtPriceLimitX96 + " is at or above MAX_SQRT_PRICE");
            }
        }
    }

    public record Snapshot(Slot0 slot0, BigInteger feeGrowthGlobal0X128, BigInteger feeGrowthGlobal1X128,
                           BigInteger liquidity, TickManager.Checkpoint ticks,
                           Map<PositionKey, Position> positions) {
    }

    private record TickCrossing(int tick, BigInteger feeGrowthGlobal0X128, BigInteger feeGrowthGlobal1X128) {
    }
}
