// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common;

/**
 * Base type for domain-level errors raised by the pool engine.
 */
public abstract class DomainError {

    private final String code;
    private final String message;

    protected DomainError(final String code, final String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    /**
     * Wraps this error so it can unwind an engine call.
     */
    public DomainException toException() {
        return new DomainException(this);
    }

    public DomainException toException(final Throwable cause) {
        return new DomainException(this, cause);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + ": " + message + "]";
    }
}
