// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import com.digitalasset.clmm.common.errors.PoolStateError;
import com.digitalasset.clmm.math.BitMath;
import com.digitalasset.clmm.math.Uint256;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tick registry plus the bitmap that indexes it.
 *
 * A tick has a registry entry exactly when its bit is set. The bitmap is keyed by word index
 * over ticks compressed by the pool's tick spacing; every method that touches the bitmap
 * takes that spacing and callers must pass the same value for the lifetime of the pool.
 *
 * Not thread-safe.
 */
public class TickManager implements TickReader {

    private static final BigInteger WORD_MASK = Uint256.MAX_UINT256;

    private final NavigableMap<Integer, TickInfo> ticks = new TreeMap<>();
    private final NavigableMap<Integer, BigInteger> bitmap = new TreeMap<>();

    public record TickUpdate(boolean flipped, BigInteger liquidityGrossAfter) {
    }

    public record NextTick(int tick, boolean initialized) {
    }

    public record FeeGrowthInside(BigInteger feeGrowthInside0X128, BigInteger feeGrowthInside1X128) {
    }

    /**
     * Saved tick records and bitmap words, used to undo a partially applied operation.
     */
    public static final class Checkpoint {
        private final Map<Integer, TickInfo> ticks = new HashMap<>();
        private final Map<Integer, BigInteger> words = new HashMap<>();
        private boolean full;

        private Checkpoint() {
        }
    }

    /**
     * Applies a signed liquidity change to a boundary tick.
     *
     * On first activation the tick's outside fee growth is seeded with the globals when the
     * tick is at or below the current tick, and its bitmap bit is set. A tick that drops to
     * zero gross liquidity keeps its record until {@link #clearTick} is called.
     *
     * @param upper true when the tick is the upper boundary of the position
     * @return whether the tick flipped between initialized and uninitialized
     */
    public TickUpdate updateTick(int tick, BigInteger liquidityDelta, BigInteger feeGrowthGlobal0X128,
                                 BigInteger feeGrowthGlobal1X128, boolean upper, int tickCurrent,
                                 int tickSpacing) {
        requireAligned(tick, tickSpacing);
        TickInfo info = ticks.getOrDefault(tick, TickInfo.EMPTY);
        BigInteger grossBefore = info.liquidityGross();
        BigInteger grossAfter = grossBefore.add(liquidityDelta);
        if (!Uint256.isUint128(grossAfter)) {
            throw PoolStateError.tickLiquidityOverflow(tick);
        }

        BigInteger net = upper ? info.liquidityNet().subtract(liquidityDelta) : info.liquidityNet().add(liquidityDelta);
        if (!Uint256.isInt128(net)) {
            throw PoolStateError.tickLiquidityOverflow(tick);
        }

        boolean wasActive = grossBefore.signum() != 0;
        boolean flipped = (grossAfter.signum() == 0) == wasActive;
        if (!wasActive && grossAfter.signum() == 0) {
            return new TickUpdate(false, grossAfter);
        }

        BigInteger outside0 = info.feeGrowthOutside0X128();
        BigInteger outside1 = info.feeGrowthOutside1X128();
        if (!wasActive && tick <= tickCurrent) {
            // By convention all growth so far happened below the tick.
            outside0 = feeGrowthGlobal0X128;
            outside1 = feeGrowthGlobal1X128;
        }

        ticks.put(tick, new TickInfo(grossAfter, net, outside0, outside1));
        if (!wasActive) {
            setBit(tick, tickSpacing, true);
        }
        return new TickUpdate(flipped, grossAfter);
    }

    /**
     * Removes a tick record together with its bitmap bit.
     */
    public void clearTick(int tick, int tickSpacing) {
        requireAligned(tick, tickSpacing);
        ticks.remove(tick);
        setBit(tick, tickSpacing, false);
    }

    /**
     * Flips a tick's outside fee growth to the other side and returns its net liquidity.
     */
    public BigInteger crossTick(int tick, BigInteger feeGrowthGlobal0X128, BigInteger feeGrowthGlobal1X128) {
        TickInfo info = ticks.get(tick);
        if (info == null) {
            return BigInteger.ZERO;
        }
        ticks.put(tick, new TickInfo(
            info.liquidityGross(),
            info.liquidityNet(),
            Uint256.wrappingSub(feeGrowthGlobal0X128, info.feeGrowthOutside0X128()),
            Uint256.wrappingSub(feeGrowthGlobal1X128, info.feeGrowthOutside1X128())));
        return info.liquidityNet();
    }

    /**
     * Searches the bitmap word containing {@code tick} for the next initialized tick.
     *
     * @param lte search at or to the left of {@code tick} when true, strictly to the right otherwise
     * @return the next initialized tick, or the word boundary with {@code initialized == false}
     */
    public NextTick nextInitializedTickWithinOneWord(int tick, int tickSpacing, boolean lte) {
        int compressed = Math.floorDiv(tick, tickSpacing);

        if (lte) {
            int wordPos = compressed >> 8;
            int bitPos = compressed & 0xff;
            BigInteger mask = BigInteger.ONE.shiftLeft(bitPos + 1).subtract(BigInteger.ONE);
            BigInteger masked = getBitmapWord(wordPos).and(mask);

            boolean initialized = masked.signum() != 0;
            int next = initialized
                ? (compressed - (bitPos - BitMath.mostSignificantBit(masked))) * tickSpacing
                : (compressed - bitPos) * tickSpacing;
            return new NextTick(next, initialized);
        }

        int start = compressed + 1;
        int wordPos = start >> 8;
        int bitPos = start & 0xff;
        BigInteger mask = WORD_MASK.xor(BigInteger.ONE.shiftLeft(bitPos).subtract(BigInteger.ONE));
        BigInteger masked = getBitmapWord(wordPos).and(mask);

        boolean initialized = masked.signum() != 0;
        int next = initialized
            ? (start + (BitMath.leastSignificantBit(masked) - bitPos)) * tickSpacing
            : (start + (255 - bitPos)) * tickSpacing;
        return new NextTick(next, initialized);
    }

    /**
     * Fee growth per unit of liquidity accumulated strictly inside {@code [tickLower, tickUpper)}.
     * All arithmetic wraps modulo 2^256.
     */
    public FeeGrowthInside getFeeGrowthInside(int tickLower, int tickUpper, int tickCurrent,
                                              BigInteger feeGrowthGlobal0X128, BigInteger feeGrowthGlobal1X128) {
        TickInfo lower = ticks.getOrDefault(tickLower, TickInfo.EMPTY);
        TickInfo upper = ticks.getOrDefault(tickUpper, TickInfo.EMPTY);

        BigInteger below0;
        BigInteger below1;
        if (tickCurrent >= tickLower) {
            below0 = lower.feeGrowthOutside0X128();
            below1 = lower.feeGrowthOutside1X128();
        } else {
            below0 = Uint256.wrappingSub(feeGrowthGlobal0X128, lower.feeGrowthOutside0X128());
            below1 = Uint256.wrappingSub(feeGrowthGlobal1X128, lower.feeGrowthOutside1X128());
        }

        BigInteger above0;
        BigInteger above1;
        if (tickCurrent < tickUpper) {
            above0 = upper.feeGrowthOutside0X128();
            above1 = upper.feeGrowthOutside1X128();
        } else {
            above0 = Uint256.wrappingSub(feeGrowthGlobal0X128, upper.feeGrowthOutside0X128());
            above1 = Uint256.wrappingSub(feeGrowthGlobal1X128, upper.feeGrowthOutside1X128());
        }

        return new FeeGrowthInside(
            Uint256.wrappingSub(Uint256.wrappingSub(feeGrowthGlobal0X128, below0), above0),
            Uint256.wrappingSub(Uint256.wrappingSub(feeGrowthGlobal1X128, below1), above1));
    }

    /**
     * Captures the records and bitmap words of the given ticks.
     */
    public Checkpoint checkpoint(int tickSpacing, int... tickIndexes) {
        Checkpoint checkpoint = new Checkpoint();
        for (int tick : tickIndexes) {
            checkpoint.ticks.put(tick, ticks.get(tick));
            int wordPos = Math.floorDiv(tick, tickSpacing) >> 8;
            checkpoint.words.put(wordPos, bitmap.get(wordPos));
        }
        return checkpoint;
    }

    /**
     * Puts back everything captured by {@link #checkpoint}.
     */
    public void restore(Checkpoint checkpoint) {
        if (checkpoint.full) {
            ticks.clear();
            bitmap.clear();
        }
        checkpoint.ticks.forEach((tick, info) -> {
            if (info == null) {
                ticks.remove(tick);
            } else {
                ticks.put(tick, info);
            }
        });
        checkpoint.words.forEach((wordPos, word) -> {
            if (word == null) {
                bitmap.remove(wordPos);
            } else {
                bitmap.put(wordPos, word);
            }
        });
    }

    /**
     * Copy of the whole registry and bitmap. Tick records are immutable, so a shallow copy
     * is enough.
     */
    public Checkpoint checkpointAll() {
        Checkpoint checkpoint = new Checkpoint();
        checkpoint.full = true;
        checkpoint.ticks.putAll(ticks);
        checkpoint.words.putAll(bitmap);
        return checkpoint;
    }

    @Override
    public Optional<TickInfo> getTick(int tick) {
        return Optional.ofNullable(ticks.get(tick));
    }

    @Override
    public boolean isInitialized(int tick) {
        return ticks.containsKey(tick);
    }

    @Override
    public BigInteger getBitmapWord(int wordPos) {
        return bitmap.getOrDefault(wordPos, BigInteger.ZERO);
    }

    @Override
    public NavigableSet<Integer> initializedTicks() {
        return Collections.unmodifiableNavigableSet(ticks.navigableKeySet());
    }

    private static void requireAligned(int tick, int tickSpacing) {
        if (tick % tickSpacing != 0) {
            throw PoolStateError.raise(PoolStateError.Kind.TICK_MISALIGNED,
                "tick " + tick + " is not a multiple of spacing " + tickSpacing);
        }
    }

    private void setBit(int tick, int tickSpacing, boolean value) {
        int compressed = tick / tickSpacing;
        int wordPos = compressed >> 8;
        int bitPos = compressed & 0xff;
        BigInteger word = getBitmapWord(wordPos);
        BigInteger updated = value ? word.setBit(bitPos) : word.clearBit(bitPos);
        if (updated.signum() == 0) {
            bitmap.remove(wordPos);
        } else {
            bitmap.put(wordPos, updated);
        }
    }
}
