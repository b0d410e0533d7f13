// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import java.math.BigInteger;

/**
 * Per-tick liquidity and fee bookkeeping.
 *
 * @param liquidityGross         total liquidity referencing this tick as a boundary
 * @param liquidityNet           liquidity added (signed) when the tick is crossed left to right
 * @param feeGrowthOutside0X128  token0 fee growth on the far side of the tick, Q128.128
 * @param feeGrowthOutside1X128  token1 fee growth on the far side of the tick, Q128.128
 */
public record TickInfo(BigInteger liquidityGross, BigInteger liquidityNet,
                       BigInteger feeGrowthOutside0X128, BigInteger feeGrowthOutside1X128) {

    public static final TickInfo EMPTY =
        new TickInfo(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
}
