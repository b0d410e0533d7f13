// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.config;

import com.digitalasset.clmm.fees.ProtocolFeeLibrary;
import com.digitalasset.clmm.fees.ProtocolFeesAccrued;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine-wide settings.
 *
 * Configuration:
 * - clmm.protocol-fee.zero-for-one=0 (hundredths of a bip, max 1000)
 * - clmm.protocol-fee.one-for-zero=0 (hundredths of a bip, max 1000)
 * - clmm.metrics.prefix=clearportx.clmm
 *
 * The protocol fee configured here is applied to every newly initialized pool.
 */
@Configuration
public class ClmmConfig {

    @Value("${clmm.protocol-fee.zero-for-one:0}")
    private int protocolFeeZeroForOne;

    @Value("${clmm.protocol-fee.one-for-zero:0}")
    private int protocolFeeOneForZero;

    public int protocolFeeZeroForOne() {
        return protocolFeeZeroForOne;
    }

    public int protocolFeeOneForZero() {
        return protocolFeeOneForZero;
    }

    /**
     * Both directional fees packed into the pool's protocol fee slot.
     *
     * @throws com.digitalasset.clmm.common.DomainException {@code PROTOCOL_FEE_TOO_LARGE} if either
     *         configured fee is out of range
     */
    public int defaultProtocolFee() {
        return ProtocolFeeLibrary.pack(protocolFeeZeroForOne, protocolFeeOneForZero);
    }

    @Bean
    public ProtocolFeesAccrued protocolFeesAccrued() {
        return new ProtocolFeesAccrued();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
