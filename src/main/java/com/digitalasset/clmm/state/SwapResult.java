// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import java.math.BigInteger;

/**
 * Outcome of {@link Pool#swap}.
 *
 * @param delta            token movements seen from the swapper
 * @param amountToProtocol protocol fee withheld, denominated in the input token
 * @param swapFee          total fee rate applied, in hundredths of a bip
 * @param ticksCrossed     number of initialized ticks crossed
 */
public record SwapResult(BalanceDelta delta, BigInteger amountToProtocol, int swapFee,
                         BigInteger sqrtPriceX96, int tick, BigInteger liquidity, int ticksCrossed) {
}
