// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm;

import com.digitalasset.clmm.config.ClmmConfig;
import com.digitalasset.clmm.fees.ProtocolFeeLibrary;
import com.digitalasset.clmm.math.FixedPoint96;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import com.digitalasset.clmm.service.PoolManagerService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@TestPropertySource(locations = "classpath:application-test.properties")
class ClmmApplicationTest {

    @Autowired
    private PoolManagerService poolManager;

    @Autowired
    private ClmmConfig config;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void testContextLoads_withConfiguredProtocolFee() {
        assertThat(config.protocolFeeZeroForOne()).isEqualTo(500);
        assertThat(config.protocolFeeOneForZero()).isEqualTo(250);

        PoolKey key = PoolKey.of(Address.fromLong(0x1), Address.fromLong(0x2), 500, 10);
        assertThat(poolManager.initializePool(Address.fromLong(0xA1), key, FixedPoint96.Q96).isOk()).isTrue();

        assertThat(poolManager.getSlot0(key).getValueUnsafe().protocolFee())
            .isEqualTo(ProtocolFeeLibrary.pack(500, 250));
        assertThat(meterRegistry.find("test.clmm.pool.initialized.total").counter()).isNotNull();
    }
}
