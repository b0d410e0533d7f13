// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.validation;

import com.digitalasset.clmm.common.DomainException;
import com.digitalasset.clmm.common.errors.HookError;
import com.digitalasset.clmm.common.errors.ValidationError;
import com.digitalasset.clmm.constants.PoolConstants;
import com.digitalasset.clmm.dto.SwapParams;
import com.digitalasset.clmm.fees.LpFeeLibrary;
import com.digitalasset.clmm.hooks.HookRegistry;
import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.PoolKey;
import org.springframework.stereotype.Component;

/**
 * Input validator for pool manager requests. Checks run before any pool is touched.
 */
@Component
public class PoolOperationValidator {

    private final HookRegistry hookRegistry;

    public PoolOperationValidator(HookRegistry hookRegistry) {
        this.hookRegistry = hookRegistry;
    }

    /**
     * Validate a pool key before the pool is created.
     *
     * @throws DomainException if the spacing, currency order, fee or extension is invalid
     */
    public void validatePoolKey(PoolKey key) {
        if (key.tickSpacing() > PoolConstants.MAX_TICK_SPACING) {
            throw ValidationError.raise(ValidationError.Kind.TICK_SPACING_TOO_LARGE,
                "tickSpacing " + key.tickSpacing() + " > " + PoolConstants.MAX_TICK_SPACING);
        }
        if (key.tickSpacing() < PoolConstants.MIN_TICK_SPACING) {
            throw ValidationError.raise(ValidationError.Kind.TICK_SPACING_TOO_SMALL,
                "tickSpacing " + key.tickSpacing() + " < " + PoolConstants.MIN_TICK_SPACING);
        }
        if (key.currency0().compareTo(key.currency1()) >= 0) {
            throw ValidationError.raise(ValidationError.Kind.CURRENCIES_OUT_OF_ORDER_OR_EQUAL,
                "currency0 " + key.currency0() + " must sort below currency1 " + key.currency1());
        }
        LpFeeLibrary.getInitialLpFee(key.fee());
        if (!hookRegistry.isRegistered(key.hooks())) {
            throw HookError.raise(HookError.Kind.HOOK_NOT_REGISTERED,
                "no extension registered at " + key.hooks());
        }
    }

    /**
     * Validate swap parameters.
     *
     * @throws DomainException if the amount is zero
     */
    public void validateSwap(SwapParams params) {
        if (params.amountSpecified().signum() == 0) {
            throw ValidationError.raise(ValidationError.Kind.SWAP_AMOUNT_CANNOT_BE_ZERO,
                "amountSpecified must be non-zero");
        }
    }

    /**
     * Validate a dynamic LP fee update. Only the pool's own extension may change its fee.
     *
     * @throws DomainException if the pool does not use dynamic fees or the sender is not its extension
     */
    public void validateDynamicFeeUpdate(Address sender, PoolKey key) {
        if (!LpFeeLibrary.isDynamicFee(key.fee())) {
            throw ValidationError.raise(ValidationError.Kind.UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE,
                "pool " + key.label() + " does not use dynamic fees");
        }
        if (!sender.equals(key.hooks())) {
            throw ValidationError.raise(ValidationError.Kind.UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE,
                sender + " is not the extension of pool " + key.label());
        }
    }
}
