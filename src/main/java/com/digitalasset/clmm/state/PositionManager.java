// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import com.digitalasset.clmm.common.errors.PoolStateError;
import com.digitalasset.clmm.math.FixedPoint128;
import com.digitalasset.clmm.math.FullMath;
import com.digitalasset.clmm.math.LiquidityMath;
import com.digitalasset.clmm.math.Uint256;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of liquidity positions and their fee checkpoints. Not thread-safe.
 */
public class PositionManager {

    private final Map<PositionKey, Position> positions = new HashMap<>();

    /**
     * Applies a liquidity change and settles the fees earned since the last update.
     *
     * Every check runs before the registry is touched, so a failure leaves the position as
     * it was. Fees that do not fit in int128 fail with {@code OVERFLOW}. A position whose
     * liquidity returns to zero is removed.
     *
     * @return fees earned since the last update (non-negative amounts)
     */
    public BalanceDelta update(PositionKey key, BigInteger liquidityDelta,
                               BigInteger feeGrowthInside0X128, BigInteger feeGrowthInside1X128) {
        Position position = positions.getOrDefault(key, Position.EMPTY);
        BigInteger liquidityNext = checkUpdate(position, liquidityDelta);

        BigInteger fees0 = BigInteger.ZERO;
        BigInteger fees1 = BigInteger.ZERO;
        if (!position.isEmpty()) {
            fees0 = accruedFees(feeGrowthInside0X128, position.feeGrowthInside0LastX128(), position.liquidity());
            fees1 = accruedFees(feeGrowthInside1X128, position.feeGrowthInside1LastX128(), position.liquidity());
        }
        BalanceDelta feesOwed = new BalanceDelta(fees0, fees1);

        if (liquidityNext.signum() == 0) {
            positions.remove(key);
        } else {
            positions.put(key, new Position(liquidityNext, feeGrowthInside0X128, feeGrowthInside1X128));
        }
        return feesOwed;
    }

    /**
     * Validates a liquidity change without applying it.
     *
     * @return the liquidity the position would hold afterwards
     */
    public BigInteger checkUpdate(PositionKey key, BigInteger liquidityDelta) {
        return checkUpdate(positions.getOrDefault(key, Position.EMPTY), liquidityDelta);
    }

    /**
     * Reinstates a previously read position, or removes it when {@code prior} is empty.
     */
    public void restore(PositionKey key, Optional<Position> prior) {
        if (prior.isPresent()) {
            positions.put(key, prior.get());
        } else {
            positions.remove(key);
        }
    }

    public Map<PositionKey, Position> snapshot() {
        return new HashMap<>(positions);
    }

    public void restoreAll(Map<PositionKey, Position> snapshot) {
        positions.clear();
        positions.putAll(snapshot);
    }

    public Optional<Position> get(PositionKey key) {
        return Optional.ofNullable(positions.get(key));
    }

    public int size() {
        return positions.size();
    }

    private static BigInteger checkUpdate(Position position, BigInteger liquidityDelta) {
        if (liquidityDelta.signum() == 0 && position.isEmpty()) {
            throw PoolStateError.raise(PoolStateError.Kind.CANNOT_UPDATE_EMPTY_POSITION,
                "cannot poke a position with no liquidity");
        }
        return LiquidityMath.addDelta(position.liquidity(), liquidityDelta);
    }

    private static BigInteger accruedFees(BigInteger feeGrowthInsideX128, BigInteger lastX128, BigInteger liquidity) {
        return FullMath.mulDiv(Uint256.wrappingSub(feeGrowthInsideX128, lastX128), liquidity, FixedPoint128.Q128);
    }
}
