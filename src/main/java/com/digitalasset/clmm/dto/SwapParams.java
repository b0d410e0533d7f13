// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.dto;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Swap request.
 *
 * @param zeroForOne        true to sell token0 for token1
 * @param amountSpecified   negative for exact input, positive for exact output
 * @param sqrtPriceLimitX96 price the swap may not move beyond
 */
public record SwapParams(boolean zeroForOne, BigInteger amountSpecified, BigInteger sqrtPriceLimitX96) {

    public SwapParams {
        Objects.requireNonNull(amountSpecified, "amountSpecified");
        Objects.requireNonNull(sqrtPriceLimitX96, "sqrtPriceLimitX96");
    }

    public boolean exactInput() {
        return amountSpecified.signum() < 0;
    }
}
