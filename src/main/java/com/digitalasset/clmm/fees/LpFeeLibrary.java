// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.fees;

import com.digitalasset.clmm.common.errors.PoolStateError;

/**
 * LP fee encoding. A pool key either carries a static fee in hundredths of a bip or the
 * dynamic-fee flag, in which case the fee starts at zero and is set by the pool's extension.
 */
public final class LpFeeLibrary {

    public static final int DYNAMIC_FEE_FLAG = 0x800000;
    public static final int MAX_LP_FEE = 1_000_000;

    private LpFeeLibrary() {
    }

    public static boolean isDynamicFee(int fee) {
        return fee == DYNAMIC_FEE_FLAG;
    }

    public static boolean isValid(int fee) {
        return fee >= 0 && fee <= MAX_LP_FEE;
    }

    public static void validate(int fee) {
        if (!isValid(fee)) {
            throw PoolStateError.raise(PoolStateError.Kind.LP_FEE_TOO_LARGE,
                "lp fee " + fee + " exceeds " + MAX_LP_FEE);
        }
    }

    /**
     * Fee a pool starts with: zero for dynamic-fee pools, the validated static fee otherwise.
     */
    public static int getInitialLpFee(int fee) {
        if (isDynamicFee(fee)) {
            return 0;
        }
        validate(fee);
        return fee;
    }
}
