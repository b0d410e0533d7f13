// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.math;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitMathTest {

    @Test
    void testMostSignificantBit_smallValues() {
        assertThat(BitMath.mostSignificantBit(BigInteger.ONE)).isZero();
        assertThat(BitMath.mostSignificantBit(BigInteger.TWO)).isEqualTo(1);
        assertThat(BitMath.mostSignificantBit(BigInteger.valueOf(3))).isEqualTo(1);
    }

    @Test
    void testMostSignificantBit_maxWord() {
        assertThat(BitMath.mostSignificantBit(Uint256.MAX_UINT256)).isEqualTo(255);
    }

    @Test
    void testLeastSignificantBit_maxWord() {
        assertThat(BitMath.leastSignificantBit(Uint256.MAX_UINT256)).isZero();
        assertThat(BitMath.leastSignificantBit(BigInteger.ONE.shiftLeft(255))).isEqualTo(255);
    }

    @Test
    void testPowersOfTwo_msbEqualsLsb() {
        for (int i = 0; i < 256; i++) {
            BigInteger x = BigInteger.ONE.shiftLeft(i);
            assertThat(BitMath.mostSignificantBit(x)).isEqualTo(i);
            assertThat(BitMath.leastSignificantBit(x)).isEqualTo(i);
        }
    }

    @Test
    void testZeroAndOversizedInputs_areRejected() {
        assertThatThrownBy(() -> BitMath.mostSignificantBit(BigInteger.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BitMath.leastSignificantBit(BigInteger.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BitMath.mostSignificantBit(Uint256.TWO_POW_256))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
