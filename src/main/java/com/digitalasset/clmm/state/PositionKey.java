// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.state;

import com.digitalasset.clmm.model.Address;
import com.digitalasset.clmm.model.Salt;

import java.util.Objects;

public record PositionKey(Address owner, int tickLower, int tickUpper, Salt salt) {

    public PositionKey {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(salt, "salt");
    }

    public static PositionKey of(Address owner, int tickLower, int tickUpper) {
        return new PositionKey(owner, tickLower, tickUpper, Salt.ZERO);
    }
}
