// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.service;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.DomainException;
import com.digitalasset.clmm.common.Result;
import com.digitalasset.clmm.common.errors.PoolStateError;
import com.digitalasset.clmm.config.ClmmConfig;
import com.digitalasset.clmm.dto.FeeGrowthGlobals;
import com.digitalasset.clmm.dto.ModifyLiquidityOutcome;
import com.digitalasset.clmm.dto.ModifyLiquidityParams;
import com.digitalasset.clmm.dto.SwapOutcome;
import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.fees.ProtocolFeesAccrued;
import com.digitalasset.clmm.hooks.HookHandle;
import com.digitalasset.clmm.hooks.HookRegistry;
import com.digitalasset.clmm.metrics.PoolMetrics;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.model.Salt;
import com.digitalasset.clmm.state.BalanceDelta;
import com.digitalasset.clmm.state.ModifyLiquidityResult;
import com.digitalasset.clmm.state.Pool;
import com.digitalasset.clmm.state.Position;
import com.digitalasset.clmm.state.PositionKey;
import com.digitalasset.clmm.state.Slot0;
import com.digitalasset.clmm.state.SwapResult;
import com.digitalasset.clmm.state.TickInfo;
import com.digitalasset.clmm.validation.PoolOperationValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for every pool operation.
 *
 * Pools are keyed by {@link PoolKey}. Operations on the same pool are serialized; operations on
 * different pools run in parallel. Every operation returns a {@link Result}: domain failures are
 * logged, counted and returned as Err, and leave the pool exactly as it was. When a pool's
 * extension runs after the pool has changed, a failure in that callback rolls the pool back.
 */
@Service
public class PoolManagerService {

    private static final Logger LOG = LoggerFactory.getLogger(PoolManagerService.class);

    private final HookRegistry hookRegistry;
    private final PoolOperationValidator validator;
    private final PoolMetrics metrics;
    private final ProtocolFeesAccrued protocolFees;
    private final ClmmConfig config;
    private final Map<PoolKey, ManagedPool> pools = new ConcurrentHashMap<>();

    public PoolManagerService(
            final HookRegistry hookRegistry,
            final PoolOperationValidator validator,
            final PoolMetrics metrics,
            final ProtocolFeesAccrued protocolFees,
            final ClmmConfig config
    ) {
        this.hookRegistry = hookRegistry;
        this.validator = validator;
        this.metrics = metrics;
        this.protocolFees = protocolFees;
        this.config = config;
    }

    /**
     * Creates and initializes a pool at the given price.
     *
     * @return the tick at the initial price
     */
    public Result<Integer, DomainError> initializePool(final Address sender, final PoolKey key,
                                                       final BigInteger sqrtPriceX96) {
        return execute("initialize", key, () -> {
            validator.validatePoolKey(key);
            HookHandle hooks = hookRegistry.resolve(key.hooks());
            ManagedPool managed = new ManagedPool(new Pool(), hooks);
            synchronized (managed) {
                if (pools.putIfAbsent(key, managed) != null) {
                    throw PoolStateError.raise(PoolStateError.Kind.POOL_ALREADY_INITIALIZED,
                        "pool " + key.label() + " is already initialized");
                }
                try {
                    hooks.beforeInitialize(sender, key, sqrtPriceX96);
                    int tick = managed.pool().initialize(sqrtPriceX96, LpFeeLibrary.getInitialLpFee(key.fee()));
                    int protocolFee = config.defaultProtocolFee();
                    if (protocolFee != 0) {
                        managed.pool().setProtocolFee(protocolFee);
                    }
                    hooks.afterInitialize(sender, key, sqrtPriceX96, tick);

                    LOG.info("Initialized pool {} tick={} sqrtPriceX96={} lpFee={} protocolFee={} hooks={}",
                        key.label(), tick, sqrtPriceX96, managed.pool().slot0().lpFee(), protocolFee, key.hooks());
                    metrics.recordPoolInitialized(key.label());
                    metrics.recordPoolLiquidity(key.label(), BigInteger.ZERO);
                    return tick;
                } catch (RuntimeException e) {
                    pools.remove(key, managed);
                    throw e;
                }
            }
        });
    }

    /**
     * Adds, removes or pokes the caller's position over {@code [tickLower, tickUpper)}.
     */
    public Result<ModifyLiquidityOutcome, DomainError> modifyLiquidity(final Address sender, final PoolKey key,
                                                                       final ModifyLiquidityParams params) {
        return withPool("modifyLiquidity", key, managed -> {
            Pool pool = managed.pool();
            HookHandle hooks = managed.hooks();
            Pool.Snapshot snapshot = hooks.hasAfterCallbacks() ? pool.snapshot() : null;

            return rollbackOnFailure(pool, snapshot, () -> {
                hooks.beforeModifyLiquidity(sender, key, params);
                ModifyLiquidityResult result = pool.modifyPosition(sender, params.tickLower(), params.tickUpper(),
                    params.liquidityDelta(), key.tickSpacing(), params.salt());
                HookHandle.DeltaSplit split = hooks.afterModifyLiquidity(sender, key, params,
                    result.callerDelta(), result.feeDelta());

                String action = liquidityAction(params.liquidityDelta());
                LOG.debug("ModifyLiquidity {} pool={} owner={} range=[{}, {}) delta={} callerDelta={} fees={}",
                    action, key.label(), sender, params.tickLower(), params.tickUpper(), params.liquidityDelta(),
                    split.callerDelta(), result.feeDelta());
                metrics.recordLiquidityModified(key.label(), action);
                metrics.recordPoolLiquidity(key.label(), pool.liquidity());
                return new ModifyLiquidityOutcome(split.callerDelta(), result.feeDelta(), split.hookDelta());
            });
        });
    }

    /**
     * Swaps against a pool. The protocol's share of the fee is accrued in the input currency.
     */
    public Result<SwapOutcome, DomainError> swap(final Address sender, final PoolKey key, final SwapParams params) {
        long started = System.nanoTime();
        return withPool("swap", key, managed -> {
            validator.validateSwap(params);
            Pool pool = managed.pool();
            HookHandle hooks = managed.hooks();
            Pool.Snapshot snapshot = hooks.hasAfterCallbacks() ? pool.snapshot() : null;

            return rollbackOnFailure(pool, snapshot, () -> {
                HookHandle.SwapAdjustment adjustment = hooks.beforeSwap(sender, key, params, pool.slot0());
                SwapResult result = pool.swap(adjustment.amountToSwap(), params.sqrtPriceLimitX96(),
                    params.zeroForOne(), key.tickSpacing(), adjustment.lpFeeOverride());
                HookHandle.DeltaSplit split = hooks.afterSwap(sender, key, params, result.delta(), adjustment);

                Address inputCurrency = params.zeroForOne() ? key.currency0() : key.currency1();
                protocolFees.accrue(inputCurrency, result.amountToProtocol());

                LOG.debug("Swap pool={} sender={} zeroForOne={} amountSpecified={} delta={} fee={} toProtocol={} tick={} crossed={}",
                    key.label(), sender, params.zeroForOne(), params.amountSpecified(), split.callerDelta(),
                    result.swapFee(), result.amountToProtocol(), result.tick(), result.ticksCrossed());
                metrics.recordSwapExecuted(key.label(), params.zeroForOne(), result.ticksCrossed(),
                    System.nanoTime() - started);
                metrics.recordPoolLiquidity(key.label(), result.liquidity());
                return new SwapOutcome(split.callerDelta(), split.hookDelta(), result.amountToProtocol(),
                    result.swapFee());
            });
        });
    }

    /**
     * Donates tokens to the pool's in-range liquidity providers.
     *
     * @return the donor's delta
     */
    public Result<BalanceDelta, DomainError> donate(final Address sender, final PoolKey key,
                                                    final BigInteger amount0, final BigInteger amount1) {
        return withPool("donate", key, managed -> {
            Pool pool = managed.pool();
            HookHandle hooks = managed.hooks();
            Pool.Snapshot snapshot = hooks.hasAfterCallbacks() ? pool.snapshot() : null;

            return rollbackOnFailure(pool, snapshot, () -> {
                hooks.beforeDonate(sender, key, amount0, amount1);
                BalanceDelta delta = pool.donate(amount0, amount1);
                hooks.afterDonate(sender, key, amount0, amount1);

                LOG.debug("Donate pool={} sender={} amount0={} amount1={}", key.label(), sender, amount0, amount1);
                metrics.recordDonation(key.label());
                return delta;
            });
        });
    }

    /**
     * Replaces a pool's packed protocol fee.
     */
    public Result<Slot0, DomainError> setProtocolFee(final PoolKey key, final int protocolFee) {
        return withPool("setProtocolFee", key, managed -> {
            managed.pool().setProtocolFee(protocolFee);
            LOG.info("Protocol fee of pool {} set to 0x{}", key.label(), Integer.toHexString(protocolFee));
            return managed.pool().slot0();
        });
    }

    /**
     * Replaces the LP fee of a dynamic-fee pool. Only the pool's extension may call this.
     */
    public Result<Slot0, DomainError> updateDynamicLpFee(final Address sender, final PoolKey key, final int lpFee) {
        return withPool("updateDynamicLpFee", key, managed -> {
            validator.validateDynamicFeeUpdate(sender, key);
            managed.pool().setLpFee(lpFee);
            LOG.debug("Dynamic LP fee of pool {} set to {}", key.label(), lpFee);
            return managed.pool().slot0();
        });
    }

    public BigInteger protocolFeesAccrued(final Address currency) {
        return protocolFees.get(currency);
    }

    /**
     * Withdraws accrued protocol fees; an amount of zero withdraws everything.
     *
     * @return the amount withdrawn
     */
    public Result<BigInteger, DomainError> collectProtocolFees(final Address currency, final BigInteger amount) {
        return execute("collectProtocolFees", null, () -> {
            BigInteger collected = protocolFees.collect(currency, amount);
            LOG.info("Collected {} protocol fees in {}", collected, currency);
            return collected;
        });
    }

    // ========================================
    // READ-ONLY ACCESSORS
    // ========================================

    public boolean isInitialized(final PoolKey key) {
        return pools.containsKey(key);
    }

    public int poolCount() {
        return pools.size();
    }

    public Result<Slot0, DomainError> getSlot0(final PoolKey key) {
        return read(key, Pool::slot0);
    }

    public Result<BigInteger, DomainError> getLiquidity(final PoolKey key) {
        return read(key, Pool::liquidity);
    }

    public Result<FeeGrowthGlobals, DomainError> getFeeGrowthGlobals(final PoolKey key) {
        return read(key, pool -> new FeeGrowthGlobals(pool.feeGrowthGlobal0X128(), pool.feeGrowthGlobal1X128()));
    }

    /**
     * @return the position, or {@link Position#EMPTY} if it holds no liquidity
     */
    public Result<Position, DomainError> getPosition(final PoolKey key, final Address owner,
                                                     final int tickLower, final int tickUpper, final Salt salt) {
        PositionKey positionKey = new PositionKey(owner, tickLower, tickUpper, salt);
        return read(key, pool -> pool.position(positionKey).orElse(Position.EMPTY));
    }

    /**
     * @return the tick's bookkeeping, or {@link TickInfo#EMPTY} if it is not initialized
     */
    public Result<TickInfo, DomainError> getTickInfo(final PoolKey key, final int tick) {
        return read(key, pool -> pool.ticks().getTick(tick).orElse(TickInfo.EMPTY));
    }

    // ========================================
    // HELPERS
    // ========================================

    private <T> Result<T, DomainError> read(final PoolKey key, final Function<Pool, T> reader) {
        return Result.capture(() -> {
            ManagedPool managed = require(key);
            synchronized (managed) {
                return reader.apply(managed.pool());
            }
        });
    }

    private <T> Result<T, DomainError> withPool(final String operation, final PoolKey key,
                                                final Function<ManagedPool, T> body) {
        return execute(operation, key, () -> {
            ManagedPool managed = require(key);
            synchronized (managed) {
                return body.apply(managed);
            }
        });
    }

    private <T> Result<T, DomainError> execute(final String operation, final PoolKey key, final Supplier<T> body) {
        try {
            return Result.ok(body.get());
        } catch (DomainException e) {
            DomainError error = e.error();
            String pool = key == null ? "-" : key.label();
            if (e.getCause() != null) {
                LOG.error("{} FAILED pool={} code={} message={}", operation, pool, error.code(), error.message(),
                    e.getCause());
            } else {
                LOG.warn("{} REJECTED pool={} code={} message={}", operation, pool, error.code(), error.message());
            }
            if ("swap".equals(operation)) {
                metrics.recordSwapFailed(pool, error.code());
            } else {
                metrics.recordOperationFailed(operation, error.code());
            }
            return Result.err(error);
        }
    }

    /**
     * Runs {@code body}; if it fails and a snapshot was taken, the pool is restored first.
     */
    private static <T> T rollbackOnFailure(final Pool pool, final Pool.Snapshot snapshot, final Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            if (snapshot != null) {
                pool.restore(snapshot);
            }
            throw e;
        }
    }

    private ManagedPool require(final PoolKey key) {
        ManagedPool managed = pools.get(key);
        if (managed == null) {
            throw PoolStateError.raise(PoolStateError.Kind.POOL_NOT_INITIALIZED,
                "pool " + key.label() + " is not initialized");
        }
        return managed;
    }

    private static String liquidityAction(final BigInteger liquidityDelta) {
        int sign = liquidityDelta.signum();
        return sign > 0 ? "add" : sign < 0 ? "remove" : "poke";
    }

    private record ManagedPool(Pool pool, HookHandle hooks) {
    }
}
