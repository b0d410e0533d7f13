// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import java.math.BigInteger;

/**
 * Liquidity provided by one owner over one tick range, with the fee growth inside the range
 * at its last update. Earned fees are paid out on every update and are not stored here.
 */
public record Position(BigInteger liquidity,
                       BigInteger feeGrowthInside0LastX128,
                       BigInteger feeGrowthInside1LastX128) {

    public static final Position EMPTY = new Position(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);

    public boolean isEmpty() {
        return liquidity.signum() == 0;
    }
}
