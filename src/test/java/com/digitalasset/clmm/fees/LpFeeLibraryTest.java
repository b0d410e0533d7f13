// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.fees;

import com.digitalasset.clmm.common.DomainException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LpFeeLibraryTest {

    @Test
    void testDynamicFlag_startsAtZero() {
        assertThat(LpFeeLibrary.isDynamicFee(LpFeeLibrary.DYNAMIC_FEE_FLAG)).isTrue();
        assertThat(LpFeeLibrary.isDynamicFee(3000)).isFalse();
        assertThat(LpFeeLibrary.getInitialLpFee(LpFeeLibrary.DYNAMIC_FEE_FLAG)).isZero();
    }

    @Test
    void testStaticFee_isValidated() {
        assertThat(LpFeeLibrary.getInitialLpFee(3000)).isEqualTo(3000);
        assertThat(LpFeeLibrary.getInitialLpFee(LpFeeLibrary.MAX_LP_FEE)).isEqualTo(1_000_000);

        assertThatThrownBy(() -> LpFeeLibrary.getInitialLpFee(1_000_001))
            .isInstanceOfSatisfying(DomainException.class, e -> assertThat(e.code()).isEqualTo("LP_FEE_TOO_LARGE"));
        assertThatThrownBy(() -> LpFeeLibrary.validate(-1))
            .isInstanceOf(DomainException.class);
    }
}
