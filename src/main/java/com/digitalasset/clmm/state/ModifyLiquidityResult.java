// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

/**
 * Outcome of {@link Pool#modifyPosition}.
 *
 * @param principalDelta tokens deposited (negative) or withdrawn (positive)
 * @param feeDelta       fees paid out to the owner, always non-negative
 * @param callerDelta    the sum of both, which is what the owner settles
 */
public record ModifyLiquidityResult(BalanceDelta principalDelta, BalanceDelta feeDelta, BalanceDelta callerDelta) {
}
