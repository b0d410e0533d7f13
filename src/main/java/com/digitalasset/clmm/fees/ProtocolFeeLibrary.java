// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.fees;

import com.digitalasset.clmm.common.errors.PoolStateError;

/**
 * Packed protocol fee: the low 12 bits apply to zero-for-one swaps, the next 12 bits to
 * one-for-zero swaps. Each half is in hundredths of a bip and capped at 1000 (0.1%).
 */
public final class ProtocolFeeLibrary {

    public static final int MAX_PROTOCOL_FEE = 1000;
    public static final int FEE_0_THRESHOLD = 1001;
    public static final int FEE_1_THRESHOLD = 1001 << 12;
    public static final int PIPS_DENOMINATOR = 1_000_000;

    private static final int HALF_MASK = 0xfff;

    private ProtocolFeeLibrary() {
    }

    public static int getZeroForOneFee(int protocolFee) {
        return protocolFee & HALF_MASK;
    }

    public static int getOneForZeroFee(int protocolFee) {
        return (protocolFee >>> 12) & HALF_MASK;
    }

    /**
     * Packs the two directional fees.
     *
     * @throws com.digitalasset.clmm.common.DomainException {@code PROTOCOL_FEE_TOO_LARGE} if either
     *         fee is outside {@code [0, MAX_PROTOCOL_FEE]}
     */
    public static int pack(int zeroForOneFee, int oneForZeroFee) {
        requireDirectionalFee("zeroForOne", zeroForOneFee);
        requireDirectionalFee("oneForZero", oneForZeroFee);
        return (oneForZeroFee << 12) | zeroForOneFee;
    }

    public static boolean isValidDirectionalFee(int fee) {
        return fee >= 0 && fee <= MAX_PROTOCOL_FEE;
    }

    public static boolean isValid(int protocolFee) {
        if (protocolFee == 0) {
            return true;
        }
        if (protocolFee < 0 || protocolFee > 0xffffff) {
            return false;
        }
        return (protocolFee & HALF_MASK) < FEE_0_THRESHOLD && (protocolFee & 0xfff000) < FEE_1_THRESHOLD;
    }

    /**
     * Fee charged on a swap when the protocol fee is taken first and the LP fee applies to
     * the remainder: {@code p + l - p * l / 1e6}.
     *
     * @param protocolFee the directional (unpacked) protocol fee
     */
    public static int calculateSwapFee(int protocolFee, int lpFee) {
        long p = protocolFee;
        long l = lpFee;
        return (int) (p + l - (p * l) / PIPS_DENOMINATOR);
    }

    private static void requireDirectionalFee(String direction, int fee) {
        if (!isValidDirectionalFee(fee)) {
            throw PoolStateError.raise(PoolStateError.Kind.PROTOCOL_FEE_TOO_LARGE,
                direction + " protocol fee " + fee + " is outside [0, " + MAX_PROTOCOL_FEE + "]");
        }
    }
}
