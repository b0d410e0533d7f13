// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common.errors;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.DomainException;

import java.util.OptionalInt;

/**
 * Rejected transition of the pool state machine.
 */
public final class PoolStateError extends DomainError {

    public enum Kind {
        TICKS_MISORDERED,
        TICK_LOWER_OUT_OF_BOUNDS,
        TICK_UPPER_OUT_OF_BOUNDS,
        TICK_MISALIGNED,
        TICK_LIQUIDITY_OVERFLOW,
        POOL_ALREADY_INITIALIZED,
        POOL_NOT_INITIALIZED,
        PRICE_LIMIT_ALREADY_EXCEEDED,
        PRICE_LIMIT_OUT_OF_BOUNDS,
        NO_LIQUIDITY_TO_RECEIVE_FEES,
        INVALID_FEE_FOR_EXACT_OUT,
        INVALID_PRICE,
        CANNOT_UPDATE_EMPTY_POSITION,
        LP_FEE_TOO_LARGE,
        PROTOCOL_FEE_TOO_LARGE
    }

    private final Kind kind;
    private final OptionalInt tick;

    public PoolStateError(final Kind kind, final String details) {
        this(kind, details, OptionalInt.empty());
    }

    private PoolStateError(final Kind kind, final String details, final OptionalInt tick) {
        super(kind.name(), details);
        this.kind = kind;
        this.tick = tick;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The offending tick, present for {@link Kind#TICK_LIQUIDITY_OVERFLOW}.
     */
    public OptionalInt tick() {
        return tick;
    }

    public static DomainException raise(final Kind kind, final String details) {
        return new PoolStateError(kind, details).toException();
    }

    public static DomainException tickLiquidityOverflow(final int tick) {
        return new PoolStateError(Kind.TICK_LIQUIDITY_OVERFLOW,
            "liquidityGross out of range at tick " + tick, OptionalInt.of(tick)).toException();
    }
}
