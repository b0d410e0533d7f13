// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.dto.ModifyLiquidityParams;
import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.state.BalanceDelta;
import com.digitalasset.clmm.state.Slot0;

import java.math.BigInteger;

/**
 * Pool extension. Every callback defaults to a no-op; a pool only invokes the callbacks
 * listed in the {@link HookCapabilities} it was registered with.
 *
 * Throwing a {@link com.digitalasset.clmm.common.DomainException} aborts the operation with
 * that error; any other exception aborts it as HOOK_CALL_FAILED.
 */
public interface Hook {

    default void beforeInitialize(Address sender, PoolKey key, BigInteger sqrtPriceX96) {
    }

    default void afterInitialize(Address sender, PoolKey key, BigInteger sqrtPriceX96, int tick) {
    }

    default void beforeAddLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params) {
    }

    /**
     * @return the extension's own delta; only applied with AFTER_ADD_LIQUIDITY_RETURNS_DELTA
     */
    default BalanceDelta afterAddLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params,
                                           BalanceDelta delta, BalanceDelta feesAccrued) {
        return BalanceDelta.ZERO;
    }

    default void beforeRemoveLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params) {
    }

    /**
     * @return the extension's own delta; only applied with AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA
     */
    default BalanceDelta afterRemoveLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params,
                                              BalanceDelta delta, BalanceDelta feesAccrued) {
        return BalanceDelta.ZERO;
    }

    /**
     * @param slot0 pool price and fees before the swap
     */
    default BeforeSwapResult beforeSwap(Address sender, PoolKey key, SwapParams params, Slot0 slot0) {
        return BeforeSwapResult.NONE;
    }

    /**
     * @return the extension's delta in the unspecified token; only applied with
     *         AFTER_SWAP_RETURNS_DELTA
     */
    default BigInteger afterSwap(Address sender, PoolKey key, SwapParams params, BalanceDelta delta) {
        return BigInteger.ZERO;
    }

    default void beforeDonate(Address sender, PoolKey key, BigInteger amount0, BigInteger amount1) {
    }

    default void afterDonate(Address sender, PoolKey key, BigInteger amount0, BigInteger amount1) {
    }
}
