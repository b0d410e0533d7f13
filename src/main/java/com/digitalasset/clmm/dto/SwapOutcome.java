// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.dto;

import com.digitalasset.clmm.state.BalanceDelta;

import java.math.BigInteger;

/**
 * Result of a swap through the pool manager.
 *
 * @param callerDelta      what the swapper settles, net of any extension delta
 * @param hookDelta        what the pool's extension settles
 * @param amountToProtocol protocol fee accrued in the input currency
 * @param swapFee          fee rate applied, in hundredths of a bip
 */
public record SwapOutcome(BalanceDelta callerDelta, BalanceDelta hookDelta,
                          BigInteger amountToProtocol, int swapFee) {
}
