// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.dto;

import com.digitalasset.clmm.model.Salt;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Liquidity change request. A positive delta adds liquidity, a negative delta removes it,
 * zero only collects fees.
 */
public record ModifyLiquidityParams(int tickLower, int tickUpper, BigInteger liquidityDelta, Salt salt) {

    public ModifyLiquidityParams {
        Objects.requireNonNull(liquidityDelta, "liquidityDelta");
        Objects.requireNonNull(salt, "salt");
    }

    public static ModifyLiquidityParams of(int tickLower, int tickUpper, long liquidityDelta) {
        return new ModifyLiquidityParams(tickLower, tickUpper, BigInteger.valueOf(liquidityDelta), Salt.ZERO);
    }

    public boolean isAdd() {
        return liquidityDelta.signum() > 0;
    }
}
