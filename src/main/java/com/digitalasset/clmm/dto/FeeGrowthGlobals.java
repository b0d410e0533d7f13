// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.dto;

import java.math.BigInteger;

/**
 * Cumulative fees per unit of liquidity for both tokens, Q128.128, wrapping at 2^256.
 */
public record FeeGrowthGlobals(BigInteger feeGrowthGlobal0X128, BigInteger feeGrowthGlobal1X128) {
}
