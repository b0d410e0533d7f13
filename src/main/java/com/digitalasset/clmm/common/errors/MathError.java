// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common.errors;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.DomainException;

/**
 * Failure of a fixed-point primitive.
 */
public final class MathError extends DomainError {

    public enum Kind {
        OVERFLOW,
        DIVISION_BY_ZERO,
        INVALID_PRICE,
        INVALID_TICK,
        INVALID_LIQUIDITY,
        PRICE_OVERFLOW,
        NOT_ENOUGH_LIQUIDITY
    }

    private final Kind kind;

    public MathError(final Kind kind, final String details) {
        super(kind.name(), details);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static DomainException raise(final Kind kind, final String details) {
        return new MathError(kind, details).toException();
    }

    public static DomainException overflow(final String details) {
        return raise(Kind.OVERFLOW, details);
    }
}
