// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.state.BalanceDelta;
import com.digitalasset.clmm.state.Slot0;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatility-scaled LP fee for dynamic-fee pools.
 *
 * Each swap is charged {@code baseFee * (100 + moveBps / 100) / 100}, clamped to
 * [minFee, maxFee], where {@code moveBps} is how far the pool price moved since the previous
 * completed swap, in basis points. The first swap on a pool pays the base fee.
 *
 * The price seen in {@code beforeSwap} becomes the new reference only in {@code afterSwap},
 * so a swap that fails in between leaves the reference where it was.
 */
public class DynamicFeeHook implements Hook {

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final int baseFee;
    private final int minFee;
    private final int maxFee;
    private final Map<PoolKey, BigInteger> lastSqrtPrice = new ConcurrentHashMap<>();
    private final Map<PoolKey, BigInteger> pendingSqrtPrice = new ConcurrentHashMap<>();

    public DynamicFeeHook(int baseFee, int minFee, int maxFee) {
        LpFeeLibrary.validate(baseFee);
        LpFeeLibrary.validate(minFee);
        LpFeeLibrary.validate(maxFee);
        if (minFee > maxFee) {
            throw new IllegalArgumentException("minFee " + minFee + " exceeds maxFee " + maxFee);
        }
        this.baseFee = baseFee;
        this.minFee = minFee;
        this.maxFee = maxFee;
    }

    public static HookCapabilities capabilities() {
        return HookCapabilities.of(HookCallback.BEFORE_SWAP, HookCallback.AFTER_SWAP);
    }

    @Override
    public BeforeSwapResult beforeSwap(Address sender, PoolKey key, SwapParams params, Slot0 slot0) {
        pendingSqrtPrice.put(key, slot0.sqrtPriceX96());
        return BeforeSwapResult.feeOverride(nextFee(key, slot0.sqrtPriceX96()));
    }

    @Override
    public BigInteger afterSwap(Address sender, PoolKey key, SwapParams params, BalanceDelta delta) {
        BigInteger price = pendingSqrtPrice.remove(key);
        if (price != null) {
            recordPrice(key, price);
        }
        return BigInteger.ZERO;
    }

    void recordPrice(PoolKey key, BigInteger sqrtPrice) {
        lastSqrtPrice.put(key, sqrtPrice);
    }

    int nextFee(PoolKey key, BigInteger currentSqrtPrice) {
        BigInteger last = lastSqrtPrice.get(key);
        if (last == null || last.signum() == 0) {
            return clamp(baseFee);
        }
        long moveBps = currentSqrtPrice.subtract(last).abs().multiply(BPS).divide(last)
            .min(BigInteger.valueOf(Integer.MAX_VALUE)).longValue();
        long multiplier = 100 + moveBps / 100;
        long fee = baseFee * multiplier / 100;
        return clamp(fee);
    }

    private int clamp(long fee) {
        return (int) Math.max(minFee, Math.min(maxFee, fee));
    }

    @Override
    public String toString() {
        return "DynamicFeeHook[base=" + baseFee + ", min=" + minFee + ", max=" + maxFee + "]";
    }
}
