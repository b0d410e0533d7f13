// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common.errors;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.DomainException;

public final class ValidationError extends DomainError {

    public enum Kind {
        TICK_SPACING_TOO_LARGE,
        TICK_SPACING_TOO_SMALL,
        CURRENCIES_OUT_OF_ORDER_OR_EQUAL,
        SWAP_AMOUNT_CANNOT_BE_ZERO,
        UNAUTHORIZED_DYNAMIC_LP_FEE_UPDATE,
        REQUEST
    }

    private final Kind kind;

    public ValidationError(final String details) {
        this(Kind.REQUEST, details);
    }

    public ValidationError(final Kind kind, final String details) {
        super(kind.name(), details);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static DomainException raise(final Kind kind, final String details) {
        return new ValidationError(kind, details).toException();
    }
}
