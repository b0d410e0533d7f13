// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common;

import java.util.Objects;

/**
 * Unchecked carrier for a {@link DomainError}. The math and state layers throw it;
 * the service layer converts it back into a {@link Result}.
 */
public class DomainException extends RuntimeException {

    private final DomainError error;

    public DomainException(final DomainError error) {
        super(Objects.requireNonNull(error, "error").code() + ": " + error.message());
        this.error = error;
    }

    public DomainException(final DomainError error, final Throwable cause) {
        super(Objects.requireNonNull(error, "error").code() + ": " + error.message(), cause);
        this.error = error;
    }

    public DomainError error() {
        return error;
    }

    public String code() {
        return error.code();
    }
}
