// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import java.math.BigInteger;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * What an extension returns before a swap.
 *
 * @param specifiedDelta   amount of the specified token the extension takes (positive) or
 *                         provides (negative); shifts the amount actually swapped
 * @param unspecifiedDelta amount of the other token the extension takes or provides
 * @param lpFeeOverride    LP fee for this swap only; honored for dynamic-fee pools
 */
public record BeforeSwapResult(BigInteger specifiedDelta, BigInteger unspecifiedDelta, OptionalInt lpFeeOverride) {

    public static final BeforeSwapResult NONE =
        new BeforeSwapResult(BigInteger.ZERO, BigInteger.ZERO, OptionalInt.empty());

    public BeforeSwapResult {
        Objects.requireNonNull(specifiedDelta, "specifiedDelta");
        Objects.requireNonNull(unspecifiedDelta, "unspecifiedDelta");
        Objects.requireNonNull(lpFeeOverride, "lpFeeOverride");
    }

    public static BeforeSwapResult feeOverride(int lpFee) {
        return new BeforeSwapResult(BigInteger.ZERO, BigInteger.ZERO, OptionalInt.of(lpFee));
    }
}
