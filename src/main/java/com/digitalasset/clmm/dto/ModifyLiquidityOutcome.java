// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.dto;

import com.digitalasset.clmm.state.BalanceDelta;

/**
 * Result of a liquidity change through the pool manager.
 *
 * @param callerDelta principal plus fees, net of any extension delta
 * @param feesAccrued fees paid out to the position as part of this change
 * @param hookDelta   what the pool's extension settles
 */
public record ModifyLiquidityOutcome(BalanceDelta callerDelta, BalanceDelta feesAccrued, BalanceDelta hookDelta) {
}
