// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.config;

import com.digitalasset.clmm.fees.ProtocolFeeLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup validation of the engine settings.
 *
 * An invalid default protocol fee does not stop the application, but every pool
 * initialization will be rejected until it is fixed.
 */
@Component
public class ClmmStartupValidation {

    private static final Logger logger = LoggerFactory.getLogger(ClmmStartupValidation.class);

    private final ClmmConfig config;

    public ClmmStartupValidation(ClmmConfig config) {
        this.config = config;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateSettings() {
        logger.info("🔍 Running startup validation for pool engine settings...");
        if (validate()) {
            logger.info("✅ Default protocol fee: zeroForOne={} oneForZero={} (max {})",
                config.protocolFeeZeroForOne(), config.protocolFeeOneForZero(), ProtocolFeeLibrary.MAX_PROTOCOL_FEE);
        }
    }

    /**
     * @return true if the configured settings are usable
     */
    boolean validate() {
        boolean allValid = true;
        if (!ProtocolFeeLibrary.isValidDirectionalFee(config.protocolFeeZeroForOne())) {
            logger.error("❌ clmm.protocol-fee.zero-for-one={} is outside [0, {}]",
                config.protocolFeeZeroForOne(), ProtocolFeeLibrary.MAX_PROTOCOL_FEE);
            allValid = false;
        }
        if (!ProtocolFeeLibrary.isValidDirectionalFee(config.protocolFeeOneForZero())) {
            logger.error("❌ clmm.protocol-fee.one-for-zero={} is outside [0, {}]",
                config.protocolFeeOneForZero(), ProtocolFeeLibrary.MAX_PROTOCOL_FEE);
            allValid = false;
        }
        if (!allValid) {
            logger.error("⚠️  Pool initialization will fail until the protocol fee is corrected");
        }
        return allValid;
    }
}
