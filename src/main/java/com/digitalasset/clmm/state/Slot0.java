// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import java.math.BigInteger;

/**
 * Price and fee settings of a pool, replaced as a whole on every change.
 *
 * @param sqrtPriceX96 current square-root price in Q64.96; zero until the pool is initialized
 * @param tick         greatest tick whose price is at or below the current price, except after a
 *                     zero-for-one swap that stops exactly on a tick price: the tick is then one
 *                     below, since that boundary tick has already been crossed
 * @param protocolFee  packed protocol fee, see {@link com.digitalasset.clmm.fees.ProtocolFeeLibrary}
 * @param lpFee        LP fee in hundredths of a bip
 */
public record Slot0(BigInteger sqrtPriceX96, int tick, int protocolFee, int lpFee) {

    public static final Slot0 UNINITIALIZED = new Slot0(BigInteger.ZERO, 0, 0, 0);

    public boolean isInitialized() {
        return sqrtPriceX96.signum() != 0;
    }

    public Slot0 withPrice(BigInteger newSqrtPriceX96, int newTick) {
        return new Slot0(newSqrtPriceX96, newTick, protocolFee, lpFee);
    }

    public Slot0 withProtocolFee(int newProtocolFee) {
        return new Slot0(sqrtPriceX96, tick, newProtocolFee, lpFee);
    }

    public Slot0 withLpFee(int newLpFee) {
        return new Slot0(sqrtPriceX96, tick, protocolFee, newLpFee);
    }
}
