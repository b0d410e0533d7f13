// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import java.math.BigInteger;

/**
 * Q128.128 scale used by the fee-growth accumulators.
 */
public final class FixedPoint128 {

    public static final BigInteger Q128 = Uint256.TWO_POW_128;

    private FixedPoint128() {
    }
}
