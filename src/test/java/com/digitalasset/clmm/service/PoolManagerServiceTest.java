// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.service;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.Result;
import com.digitalasset.clmm.config.ClmmConfig;
import com.digitalasset.clmm.dto.ModifyLiquidityOutcome;
import com.digitalasset.clmm.dto.ModifyLiquidityParams;
import com.digitalasset.clmm.dto.SwapOutcome;
import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.fees.ProtocolFeeLibrary;
import com.digitalasset.clmm.fees.ProtocolFeesAccrued;
import com.digitalasset.clmm.hooks.DynamicFeeHook;
import com.digitalasset.clmm.hooks.Hook;
import com.digitalasset.clmm.hooks.HookCallback;
import com.digitalasset.clmm.hooks.HookCapabilities;
import com.digitalasset.clmm.hooks.HookRegistry;
import com.digitalasset.clmm.math.FixedPoint96;
import com.digitalasset.clmm.math.TickMath;
import com.digitalasset.clmm.metrics.PoolMetrics;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.model.Salt;
import com.digitalasset.clmm.state.BalanceDelta;
import com.digitalasset.clmm.state.Position;
import com.digitalasset.clmm.state.Slot0;
import com.digitalasset.clmm.state.TickInfo;
import com.digitalasset.clmm.validation.PoolOperationValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Pool Manager Service Tests")
class PoolManagerServiceTest {

    private static final Address USDC = Address.fromLong(0x1000);
    private static final Address WETH = Address.fromLong(0x2000);
    private static final Address ALICE = Address.fromLong(0xA1);
    private static final Address HOOK_ADDRESS = Address.fromLong(0xF00);
    private static final BigInteger Q96 = FixedPoint96.Q96;
    private static final BigInteger E15 = BigInteger.TEN.pow(15);
    private static final BigInteger E18 = BigInteger.TEN.pow(18);
    private static final PoolKey KEY = PoolKey.of(USDC, WETH, 3000, 60);
    private static final SwapParams EXACT_IN_1E15 =
        new SwapParams(true, E15.negate(), TickMath.MIN_SQRT_PRICE.add(BigInteger.ONE));

    private SimpleMeterRegistry meterRegistry;
    private HookRegistry hookRegistry;
    private ClmmConfig config;
    private PoolManagerService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        hookRegistry = new HookRegistry();
        config = new ClmmConfig();
        service = new PoolManagerService(hookRegistry, new PoolOperationValidator(hookRegistry),
            new PoolMetrics(meterRegistry, "clmm.test"), new ProtocolFeesAccrued(), config);
    }

    @Nested
    @DisplayName("initializePool")
    class InitializePool {

        @Test
        void testInitialize_returnsTickAndRecordsMetrics() {
            Result<Integer, DomainError> result = service.initializePool(ALICE, KEY, Q96);

            assertThat(result.isOk()).isTrue();
            assertThat(result.getValueUnsafe()).isZero();
            assertThat(service.isInitialized(KEY)).isTrue();
            assertThat(service.getSlot0(KEY).getValueUnsafe()).isEqualTo(new Slot0(Q96, 0, 0, 3000));
            assertThat(meterRegistry.get("clmm.test.pool.initialized.total").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("clmm.test.pool.active.count").gauge().value()).isEqualTo(1.0);
        }

        @Test
        void testInitialize_twiceIsRejected() {
            service.initializePool(ALICE, KEY, Q96);

            Result<Integer, DomainError> second = service.initializePool(ALICE, KEY, Q96);

            assertCode(second, "POOL_ALREADY_INITIALIZED");
            assertThat(service.poolCount()).isEqualTo(1);
        }

        @Test
        void testInitialize_invalidKeys() {
            assertCode(service.initializePool(ALICE, PoolKey.of(USDC, WETH, 3000, 0), Q96), "TICK_SPACING_TOO_SMALL");
            assertCode(service.initializePool(ALICE, PoolKey.of(USDC, WETH, 3000, 16385), Q96), "TICK_SPACING_TOO_LARGE");
            assertCode(service.initializePool(ALICE, PoolKey.of(WETH, USDC, 3000, 60), Q96),
                "CURRENCIES_OUT_OF_ORDER_OR_EQUAL");
            assertCode(service.initializePool(ALICE, PoolKey.of(USDC, USDC, 3000, 60), Q96),
                "CURRENCIES_OUT_OF_ORDER_OR_EQUAL");
            assertCode(service.initializePool(ALICE, PoolKey.of(USDC, WETH, 1_000_001, 60), Q96), "LP_FEE_TOO_LARGE");
            assertCode(service.initializePool(ALICE, new PoolKey(USDC, WETH, 3000, 60, HOOK_ADDRESS), Q96),
                "HOOK_NOT_REGISTERED");
            assertThat(service.poolCount()).isZero();
            assertThat(meterRegistry.get("clmm.test.operation.failed.total")
                .tag("operation", "initialize").tag("reason", "LP_FEE_TOO_LARGE").counter().count()).isEqualTo(1.0);
        }

        @Test
        void testInitialize_invalidPriceLeavesNoPool() {
            Result<Integer, DomainError> result = service.initializePool(ALICE, KEY, BigInteger.ONE);

            assertCode(result, "INVALID_PRICE");
            assertThat(service.isInitialized(KEY)).isFalse();
        }

        @Test
        void testInitialize_appliesConfiguredProtocolFee() {
            ReflectionTestUtils.setField(config, "protocolFeeZeroForOne", 500);
            ReflectionTestUtils.setField(config, "protocolFeeOneForZero", 250);

            service.initializePool(ALICE, KEY, Q96);

            assertThat(service.getSlot0(KEY).getValueUnsafe().protocolFee())
                .isEqualTo(ProtocolFeeLibrary.pack(500, 250));
        }

        @Test
        void testInitialize_outOfRangeConfiguredProtocolFeeLeavesNoPool() {
            ReflectionTestUtils.setField(config, "protocolFeeZeroForOne", 5000);

            Result<Integer, DomainError> result = service.initializePool(ALICE, KEY, Q96);

            assertCode(result, "PROTOCOL_FEE_TOO_LARGE");
            assertThat(service.isInitialized(KEY)).isFalse();
        }

        @Test
        void testInitialize_failingExtensionLeavesNoPool() {
            hookRegistry.register(HOOK_ADDRESS, new Hook() {
                @Override
                public void afterInitialize(Address sender, PoolKey key, BigInteger sqrtPriceX96, int tick) {
                    throw new IllegalStateException("not today");
                }
            }, HookCapabilities.of(HookCallback.AFTER_INITIALIZE));
            PoolKey hooked = new PoolKey(USDC, WETH, 3000, 60, HOOK_ADDRESS);

            assertCode(service.initializePool(ALICE, hooked, Q96), "HOOK_CALL_FAILED");
            assertThat(service.isInitialized(hooked)).isFalse();
        }
    }

    @Nested
    @DisplayName("pool operations")
    class PoolOperations {

        @BeforeEach
        void initialize() {
            service.initializePool(ALICE, KEY, Q96);
        }

        @Test
        void testModifyLiquidity_addAndRead() {
            // Act
            Result<ModifyLiquidityOutcome, DomainError> result =
                service.modifyLiquidity(ALICE, KEY, ModifyLiquidityParams.of(-120, 120, 1_000_000));

            // Assert
            assertThat(result.getValueUnsafe().callerDelta()).isEqualTo(BalanceDelta.of(-5982, -5982));
            assertThat(result.getValueUnsafe().hookDelta()).isEqualTo(BalanceDelta.ZERO);
            assertThat(service.getLiquidity(KEY).getValueUnsafe()).isEqualTo(BigInteger.valueOf(1_000_000));
            Position position = service.getPosition(KEY, ALICE, -120, 120, Salt.ZERO).getValueUnsafe();
            assertThat(position.liquidity()).isEqualTo(BigInteger.valueOf(1_000_000));
            assertThat(service.getTickInfo(KEY, -120).getValueUnsafe().liquidityNet())
                .isEqualTo(BigInteger.valueOf(1_000_000));
            assertThat(service.getTickInfo(KEY, 600).getValueUnsafe()).isEqualTo(TickInfo.EMPTY);
            assertThat(meterRegistry.get("clmm.test.liquidity.modified.total")
                .tag("action", "add").counter().count()).isEqualTo(1.0);
        }

        @Test
        void testModifyLiquidity_invalidRangeIsRejected() {
            assertCode(service.modifyLiquidity(ALICE, KEY, ModifyLiquidityParams.of(-61, 60, 1)), "TICK_MISALIGNED");
            assertThat(service.getPosition(KEY, ALICE, -61, 60, Salt.ZERO).getValueUnsafe()).isEqualTo(Position.EMPTY);
        }

        @Test
        void testSwap_exactInput() {
            service.modifyLiquidity(ALICE, KEY, new ModifyLiquidityParams(-600, 600, E18, Salt.ZERO));

            Result<SwapOutcome, DomainError> result = service.swap(ALICE, KEY, EXACT_IN_1E15);

            SwapOutcome outcome = result.getValueUnsafe();
            assertThat(outcome.callerDelta())
                .isEqualTo(new BalanceDelta(E15.negate(), new BigInteger("996006981039903")));
            assertThat(outcome.swapFee()).isEqualTo(3000);
            assertThat(outcome.amountToProtocol()).isZero();
            assertThat(service.getFeeGrowthGlobals(KEY).getValueUnsafe().feeGrowthGlobal0X128())
                .isEqualTo(new BigInteger("1020847100762815390390123822295304"));
            assertThat(meterRegistry.get("clmm.test.swap.executed.total").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("clmm.test.pool.liquidity").tag("pool", KEY.label()).gauge().value())
                .isEqualTo(1.0e18);
        }

        @Test
        void testSwap_zeroAmountIsRejectedAndCounted() {
            Result<SwapOutcome, DomainError> result =
                service.swap(ALICE, KEY,
                    new SwapParams(true, BigInteger.ZERO, EXACT_IN_1E15.sqrtPriceLimitX96()));

            assertCode(result, "SWAP_AMOUNT_CANNOT_BE_ZERO");
            assertThat(meterRegistry.get("clmm.test.swap.failed.total").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("clmm.test.swap.failed.by_reason")
                .tag("reason", "SWAP_AMOUNT_CANNOT_BE_ZERO").counter().count()).isEqualTo(1.0);
        }

        @Test
        void testDonate_requiresInRangeLiquidity() {
            assertCode(service.donate(ALICE, KEY, BigInteger.ONE, BigInteger.ONE), "NO_LIQUIDITY_TO_RECEIVE_FEES");

            service.modifyLiquidity(ALICE, KEY, ModifyLiquidityParams.of(-120, 120, 1_000_000));
            Result<BalanceDelta, DomainError> donated =
                service.donate(ALICE, KEY, BigInteger.valueOf(1000), BigInteger.ZERO);

            assertThat(donated.getValueUnsafe()).isEqualTo(BalanceDelta.of(-1000, 0));
            Result<ModifyLiquidityOutcome, DomainError> poke =
                service.modifyLiquidity(ALICE, KEY, ModifyLiquidityParams.of(-120, 120, 0));
            assertThat(poke.getValueUnsafe().feesAccrued()).isEqualTo(BalanceDelta.of(999, 0));
        }

        @Test
        void testProtocolFees_accrueInInputCurrencyAndCollect() {
            // Arrange
            service.setProtocolFee(KEY, ProtocolFeeLibrary.pack(1000, 0));
            service.modifyLiquidity(ALICE, KEY, new ModifyLiquidityParams(-600, 600, E18, Salt.ZERO));

            // Act
            SwapOutcome outcome = service.swap(ALICE, KEY, EXACT_IN_1E15).getValueUnsafe();

            // Assert
            BigInteger expected = new BigInteger("1000000000000");
            assertThat(outcome.amountToProtocol()).isEqualTo(expected);
            assertThat(service.protocolFeesAccrued(USDC)).isEqualTo(expected);
            assertThat(service.protocolFeesAccrued(WETH)).isZero();

            assertCode(service.collectProtocolFees(USDC, expected.add(BigInteger.ONE)), "REQUEST");
            assertThat(service.collectProtocolFees(USDC, BigInteger.ZERO).getValueUnsafe()).isEqualTo(expected);
            assertThat(service.protocolFeesAccrued(USDC)).isZero();
        }

        @Test
        void testSetProtocolFee_rejectsOversizedFee() {
            assertCode(service.setProtocolFee(KEY, 1001 << 12), "PROTOCOL_FEE_TOO_LARGE");
            assertThat(service.getSlot0(KEY).getValueUnsafe().protocolFee()).isZero();
        }

        @Test
        void testUpdateDynamicLpFee_staticPoolIsRejected() {
            assertCode(service.updateDynamicLpFee(Address.ZERO, KEY, 500), "UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE");
        }

        @Test
        void testConcurrentLiquidityAdds_areSerialized() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<Result<ModifyLiquidityOutcome, DomainError>>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    Address owner = Address.fromLong(0x100 + (i % 8));
                    futures.add(executor.submit(() ->
                        service.modifyLiquidity(owner, KEY, ModifyLiquidityParams.of(-120, 120, 1_000))));
                }
                for (Future<Result<ModifyLiquidityOutcome, DomainError>> future : futures) {
                    assertThat(future.get(10, TimeUnit.SECONDS).isOk()).isTrue();
                }
            } finally {
                executor.shutdownNow();
            }

            assertThat(service.getLiquidity(KEY).getValueUnsafe()).isEqualTo(BigInteger.valueOf(200_000));
            assertThat(service.getTickInfo(KEY, 120).getValueUnsafe().liquidityGross())
                .isEqualTo(BigInteger.valueOf(200_000));
        }
    }

    @Test
    void testOperationsOnUnknownPool_areRejected() {
        assertCode(service.modifyLiquidity(ALICE, KEY, ModifyLiquidityParams.of(-60, 60, 1)), "POOL_NOT_INITIALIZED");
        assertCode(service.swap(ALICE, KEY, EXACT_IN_1E15), "POOL_NOT_INITIALIZED");
        assertCode(service.donate(ALICE, KEY, BigInteger.ONE, BigInteger.ONE), "POOL_NOT_INITIALIZED");
        assertCode(service.getSlot0(KEY), "POOL_NOT_INITIALIZED");
    }

    @Nested
    @DisplayName("extensions")
    class Extensions {

        private final PoolKey dynamicKey =
            new PoolKey(USDC, WETH, LpFeeLibrary.DYNAMIC_FEE_FLAG, 60, HOOK_ADDRESS);

        @Test
        void testDynamicFeePool_usesExtensionFee() {
            hookRegistry.register(HOOK_ADDRESS, new DynamicFeeHook(3000, 500, 10_000), DynamicFeeHook.capabilities());
            service.initializePool(ALICE, dynamicKey, Q96);
            service.modifyLiquidity(ALICE, dynamicKey, new ModifyLiquidityParams(-600, 600, E18, Salt.ZERO));

            SwapOutcome outcome = service.swap(ALICE, dynamicKey, EXACT_IN_1E15).getValueUnsafe();

            assertThat(service.getSlot0(dynamicKey).getValueUnsafe().lpFee()).isZero();
            assertThat(outcome.swapFee()).isEqualTo(3000);
            assertThat(outcome.callerDelta())
                .isEqualTo(new BalanceDelta(E15.negate(), new BigInteger("996006981039903")));
        }

        @Test
        void testUpdateDynamicLpFee_onlyByExtension() {
            hookRegistry.register(HOOK_ADDRESS, new DynamicFeeHook(3000, 500, 10_000), DynamicFeeHook.capabilities());
            service.initializePool(ALICE, dynamicKey, Q96);

            assertCode(service.updateDynamicLpFee(ALICE, dynamicKey, 5000), "UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE");
            Result<Slot0, DomainError> updated = service.updateDynamicLpFee(HOOK_ADDRESS, dynamicKey, 5000);

            assertThat(updated.getValueUnsafe().lpFee()).isEqualTo(5000);
            assertCode(service.updateDynamicLpFee(HOOK_ADDRESS, dynamicKey, 1_000_001), "LP_FEE_TOO_LARGE");
        }

        @Test
        void testFailingAfterSwap_rollsBackThePool() {
            // Arrange
            PoolKey hooked = new PoolKey(USDC, WETH, 3000, 60, HOOK_ADDRESS);
            hookRegistry.register(HOOK_ADDRESS, new Hook() {
                @Override
                public BigInteger afterSwap(Address sender, PoolKey key, SwapParams params, BalanceDelta delta) {
                    throw new IllegalStateException("rejecting swap " + delta);
                }
            }, HookCapabilities.of(HookCallback.AFTER_SWAP));
            service.initializePool(ALICE, hooked, Q96);
            service.modifyLiquidity(ALICE, hooked, new ModifyLiquidityParams(-600, 600, E18, Salt.ZERO));
            Slot0 before = service.getSlot0(hooked).getValueUnsafe();

            // Act
            Result<SwapOutcome, DomainError> result = service.swap(ALICE, hooked, EXACT_IN_1E15);

            // Assert
            assertCode(result, "HOOK_CALL_FAILED");
            assertThat(service.getSlot0(hooked).getValueUnsafe()).isEqualTo(before);
            assertThat(service.getFeeGrowthGlobals(hooked).getValueUnsafe().feeGrowthGlobal0X128()).isZero();
            assertThat(service.getLiquidity(hooked).getValueUnsafe()).isEqualTo(E18);
        }

        @Test
        void testFailingAfterAddLiquidity_rollsBackThePosition() {
            PoolKey hooked = new PoolKey(USDC, WETH, 3000, 60, HOOK_ADDRESS);
            hookRegistry.register(HOOK_ADDRESS, new Hook() {
                @Override
                public BalanceDelta afterAddLiquidity(Address sender, PoolKey key, ModifyLiquidityParams params,
                                                      BalanceDelta delta, BalanceDelta feesAccrued) {
                    throw new IllegalArgumentException("no deposits");
                }
            }, HookCapabilities.of(HookCallback.AFTER_ADD_LIQUIDITY));
            service.initializePool(ALICE, hooked, Q96);

            assertCode(service.modifyLiquidity(ALICE, hooked, ModifyLiquidityParams.of(-120, 120, 1_000_000)),
                "HOOK_CALL_FAILED");

            assertThat(service.getLiquidity(hooked).getValueUnsafe()).isZero();
            assertThat(service.getPosition(hooked, ALICE, -120, 120, Salt.ZERO).getValueUnsafe())
                .isEqualTo(Position.EMPTY);
            assertThat(service.getTickInfo(hooked, -120).getValueUnsafe()).isEqualTo(TickInfo.EMPTY);
        }
    }

    private static void assertCode(Result<?, DomainError> result, String expectedCode) {
        assertThat(result.isErr()).as("expected %s but got %s", expectedCode, result).isTrue();
        assertThat(result.getErrorUnsafe().code()).isEqualTo(expectedCode);
    }
}
