// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.metrics;

import com.digitalasset.clmm.constants.PoolConstants;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics collector for pool manager operations.
 *
 * Provides Micrometer metrics for:
 * - Pool lifecycle and operation counters
 * - Swap failures by reason
 * - Ticks crossed per swap
 * - Active liquidity gauges (registered once per pool, updated via AtomicReference)
 *
 * CARDINALITY SAFETY:
 * - Pools are tagged with {@code PoolKey.label()}, never with raw addresses
 * - Failure reasons are error codes, truncated when unexpectedly long
 */
@Component
public class PoolMetrics {

    private final MeterRegistry meterRegistry;
    private final String prefix;
    private final Counter poolsInitialized;
    private final Counter swapsExecuted;
    private final Counter swapsFailed;
    private final Counter donations;
    private final DistributionSummary ticksCrossed;
    private final Timer swapExecutionTime;

    private final AtomicInteger activePoolsCount = new AtomicInteger(0);
    private final Map<String, AtomicReference<BigInteger>> liquidityGauges = new ConcurrentHashMap<>();

    public PoolMetrics(MeterRegistry meterRegistry,
                       @Value("${clmm.metrics.prefix:" + PoolConstants.DEFAULT_METRICS_PREFIX + "}") String prefix) {
        this.meterRegistry = meterRegistry;
        this.prefix = prefix;

        this.poolsInitialized = Counter.builder(prefix + ".pool.initialized.total")
            .description("Total number of pools initialized")
            .register(meterRegistry);

        this.swapsExecuted = Counter.builder(prefix + ".swap.executed.total")
            .description("Total number of swaps executed successfully")
            .register(meterRegistry);

        this.swapsFailed = Counter.builder(prefix + ".swap.failed.total")
            .description("Total number of swaps that failed")
            .register(meterRegistry);

        this.donations = Counter.builder(prefix + ".donate.total")
            .description("Total number of donations to in-range liquidity")
            .register(meterRegistry);

        this.ticksCrossed = DistributionSummary.builder(prefix + ".swap.ticks_crossed")
            .description("Distribution of initialized ticks crossed per swap")
            .baseUnit("ticks")
            .register(meterRegistry);

        this.swapExecutionTime = Timer.builder(prefix + ".swap.execution.time")
            .description("Time taken to execute swaps")
            .register(meterRegistry);

        Gauge.builder(prefix + ".pool.active.count", activePoolsCount, AtomicInteger::get)
            .description("Number of initialized pools")
            .register(meterRegistry);
    }

    /**
     * Record a newly initialized pool.
     */
    public void recordPoolInitialized(String pool) {
        poolsInitialized.increment();
        activePoolsCount.incrementAndGet();
        meterRegistry.counter(prefix + ".pool.initialized.by_pool", "pool", pool).increment();
    }

    /**
     * Record a successful swap.
     */
    public void recordSwapExecuted(String pool, boolean zeroForOne, int crossed, long executionTimeNanos) {
        swapsExecuted.increment();
        meterRegistry.counter(prefix + ".swap.executed.by_pool",
            "pool", pool,
            "direction", zeroForOne ? "zero_for_one" : "one_for_zero").increment();
        ticksCrossed.record(crossed);
        swapExecutionTime.record(executionTimeNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Record a rejected swap.
     */
    public void recordSwapFailed(String pool, String reason) {
        swapsFailed.increment();
        meterRegistry.counter(prefix + ".swap.failed.by_reason",
            "reason", normalizeReason(reason),
            "pool", pool).increment();
    }

    /**
     * Record a liquidity change; {@code action} is add, remove or poke.
     */
    public void recordLiquidityModified(String pool, String action) {
        meterRegistry.counter(prefix + ".liquidity.modified.total",
            "pool", pool,
            "action", action).increment();
    }

    public void recordDonation(String pool) {
        donations.increment();
        meterRegistry.counter(prefix + ".donate.by_pool", "pool", pool).increment();
    }

    /**
     * Record any other rejected operation.
     */
    public void recordOperationFailed(String operation, String reason) {
        meterRegistry.counter(prefix + ".operation.failed.total",
            "operation", operation,
            "reason", normalizeReason(reason)).increment();
    }

    /**
     * Update the active liquidity gauge of a pool.
     * Gauges are registered once and updated via AtomicReference.
     */
    public void recordPoolLiquidity(String pool, BigInteger liquidity) {
        liquidityGauges.computeIfAbsent(pool, p -> {
            AtomicReference<BigInteger> ref = new AtomicReference<>(liquidity);
            Gauge.builder(prefix + ".pool.liquidity", ref, r -> r.get().doubleValue())
                .tag("pool", pool)
                .description("Active in-range liquidity")
                .register(meterRegistry);
            return ref;
        }).set(liquidity);
    }

    public int activePoolsCount() {
        return activePoolsCount.get();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private String normalizeReason(String reason) {
        if (reason == null) return "unknown";
        if (reason.length() > PoolConstants.MAX_REASON_TAG_LENGTH) {
            return reason.substring(0, PoolConstants.MAX_REASON_TAG_LENGTH - 3) + "...";
        }
        return reason;
    }
}
