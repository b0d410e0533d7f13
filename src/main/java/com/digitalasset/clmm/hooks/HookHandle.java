// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.common.DomainException;
import com.digitalasset.clmm.common.errors.HookError;
import com.digitalasset.clmm.dto.ModifyLiquidityParams;
import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.state.BalanceDelta;
import com.digitalasset.clmm.state.Slot0;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Supplier;

import static com.digitalasset.clmm.hooks.HookCallback.*;

/**
 * A pool's extension together with the callbacks it opted into. Callbacks outside the
 * capability set are never invoked, and returned deltas are only honored when the matching
 * returns-delta flag is present.
 */
public record HookHandle(Hook hook, HookCapabilities capabilities) {

    private static final EnumSet<HookCallback> AFTER_CALLBACKS =
        EnumSet.of(AFTER_INITIALIZE, AFTER_ADD_LIQUIDITY, AFTER_REMOVE_LIQUIDITY, AFTER_SWAP, AFTER_DONATE);

    public HookHandle {
        Objects.requireNonNull(hook, "hook");
        Objects.requireNonNull(capabilities, "capabilities");
    }

    /**
     * Amount the pool should actually swap, with the extension's before-swap adjustments.
     */
    public record SwapAdjustment(BigInteger amountToSwap, BigInteger specifiedDelta,
                                 BigInteger unspecifiedDelta, OptionalInt lpFeeOverride) {
    }

    /**
     * Final split of a swap's delta between the swapper and the extension.
     */
    public record DeltaSplit(BalanceDelta callerDelta, BalanceDelta hookDelta) {
    }

    /**
     * Whether any callback runs after the pool has already changed state.
     */
    public boolean hasAfterCallbacks() {
        return AFTER_CALLBACKS.stream().anyMatch(capabilities::isEnabled);
    }

    public void beforeInitialize(Address sender, PoolKey key, BigInteger sqrtPriceX96) {
        if (capabilities.isEnabled(BEFORE_INITIALIZE)) {
            run(BEFORE_INITIALIZE, () -> hook.beforeInitialize(sender, key, sqrtPriceX96));
        }
    }

    public void afterInitialize(Address sender, PoolKey key, BigInteger sqrtPriceX96, int tick) {
        if (capabilities.isEnabled(AFTER_INITIALIZE)) {
            run(AFTER_INITIALIZE, () -> hook.afterInitialize(sender, key, sqrtPriceX96, tick));
        }
    }

    public void beforeModifyLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params) {
        if (params.isAdd()) {
            if (capabilities.isEnabled(BEFORE_ADD_LIQUIDITY)) {
                run(BEFORE_ADD_LIQUIDITY, () -> hook.beforeAddLiquidity(sender, key, params));
            }
        } else if (capabilities.isEnabled(BEFORE_REMOVE_LIQUIDITY)) {
            run(BEFORE_REMOVE_LIQUIDITY, () -> hook.beforeRemoveLiquidity(sender, key, params));
        }
    }

    /**
     * Runs the after-liquidity callback and moves any extension delta off the caller.
     */
    public DeltaSplit afterModifyLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params,
                                           BalanceDelta callerDelta, BalanceDelta feesAccrued) {
        HookCallback callback = params.isAdd() ? AFTER_ADD_LIQUIDITY : AFTER_REMOVE_LIQUIDITY;
        HookCallback returnsDelta = params.isAdd()
            ? AFTER_ADD_LIQUIDITY_RETURNS_DELTA
            : AFTER_REMOVE_LIQUIDITY_RETURNS_DELTA;
        if (!capabilities.isEnabled(callback)) {
            return new DeltaSplit(callerDelta, BalanceDelta.ZERO);
        }

        BalanceDelta hookDelta = call(callback, () -> params.isAdd()
            ? hook.afterAddLiquidity(sender, key, params, callerDelta, feesAccrued)
            : hook.afterRemoveLiquidity(sender, key, params, callerDelta, feesAccrued));
        if (!capabilities.isEnabled(returnsDelta) || hookDelta == null || hookDelta.isZero()) {
            return new DeltaSplit(callerDelta, BalanceDelta.ZERO);
        }
        return new DeltaSplit(callerDelta.subtract(hookDelta), hookDelta);
    }

    /**
     * Runs the before-swap callback.
     *
     * @throws DomainException HOOK_DELTA_EXCEEDS_SWAP_AMOUNT when the extension's specified
     *         delta would flip the swap between exact input and exact output
     */
    public SwapAdjustment beforeSwap(Address sender, PoolKey key, SwapParams params, Slot0 slot0) {
        BigInteger amount = params.amountSpecified();
        if (!capabilities.isEnabled(BEFORE_SWAP)) {
            return new SwapAdjustment(amount, BigInteger.ZERO, BigInteger.ZERO, OptionalInt.empty());
        }

        BeforeSwapResult result = call(BEFORE_SWAP, () -> hook.beforeSwap(sender, key, params, slot0));
        if (result == null) {
            result = BeforeSwapResult.NONE;
        }
        OptionalInt lpFeeOverride = LpFeeLibrary.isDynamicFee(key.fee())
            ? result.lpFeeOverride()
            : OptionalInt.empty();

        if (!capabilities.isEnabled(BEFORE_SWAP_RETURNS_DELTA)) {
            return new SwapAdjustment(amount, BigInteger.ZERO, BigInteger.ZERO, lpFeeOverride);
        }

        BigInteger specified = result.specifiedDelta();
        if (specified.signum() != 0) {
            boolean exactInput = amount.signum() < 0;
            BigInteger adjusted = amount.add(specified);
            if (exactInput ? adjusted.signum() > 0 : adjusted.signum() < 0) {
                throw HookError.raise(HookError.Kind.HOOK_DELTA_EXCEEDS_SWAP_AMOUNT,
                    "specified delta " + specified + " exceeds swap amount " + amount);
            }
            amount = adjusted;
        }
        return new SwapAdjustment(amount, specified, result.unspecifiedDelta(), lpFeeOverride);
    }

    /**
     * Runs the after-swap callback and splits the pool's swap delta between the swapper and
     * the extension.
     */
    public DeltaSplit afterSwap(Address sender, PoolKey key, SwapParams params, BalanceDelta swapDelta,
                                SwapAdjustment adjustment) {
        BigInteger specified = adjustment.specifiedDelta();
        BigInteger unspecified = adjustment.unspecifiedDelta();

        if (capabilities.isEnabled(AFTER_SWAP)) {
            BigInteger afterDelta = call(AFTER_SWAP, () -> hook.afterSwap(sender, key, params, swapDelta));
            if (capabilities.isEnabled(AFTER_SWAP_RETURNS_DELTA) && afterDelta != null) {
                unspecified = unspecified.add(afterDelta);
            }
        }

        if (specified.signum() == 0 && unspecified.signum() == 0) {
            return new DeltaSplit(swapDelta, BalanceDelta.ZERO);
        }
        // The specified token is token0 when selling token0 exactly or buying token1 exactly.
        BalanceDelta hookDelta = params.exactInput() == params.zeroForOne()
            ? new BalanceDelta(specified, unspecified)
            : new BalanceDelta(unspecified, specified);
        return new DeltaSplit(swapDelta.subtract(hookDelta), hookDelta);
    }

    public void beforeDonate(Address sender, PoolKey key, BigInteger amount0, BigInteger amount1) {
        if (capabilities.isEnabled(BEFORE_DONATE)) {
            run(BEFORE_DONATE, () -> hook.beforeDonate(sender, key, amount0, amount1));
        }
    }

    public void afterDonate(Address sender, PoolKey key, BigInteger amount0, BigInteger amount1) {
        if (capabilities.isEnabled(AFTER_DONATE)) {
            run(AFTER_DONATE, () -> hook.afterDonate(sender, key, amount0, amount1));
        }
    }

    private void run(HookCallback callback, Runnable body) {
        call(callback, () -> {
            body.run();
            return null;
        });
    }

    private <T> T call(HookCallback callback, Supplier<T> body) {
        try {
            return body.get();
        } catch (DomainException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HookError(HookError.Kind.HOOK_CALL_FAILED,
                hook + " failed in " + callback + ": " + e.getMessage()).toException(e);
        }
    }
}
