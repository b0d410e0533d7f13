// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.common.errors;

import com.digitalasset.clmm.common.DomainError;
import com.digitalasset.clmm.common.DomainException;

public final class HookError extends DomainError {

    public enum Kind {
        HOOK_NOT_REGISTERED,
        INVALID_CAPABILITIES,
        HOOK_DELTA_EXCEEDS_SWAP_AMOUNT,
        HOOK_CALL_FAILED
    }

    private final Kind kind;

    public HookError(final Kind kind, final String details) {
        super(kind.name(), details);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static DomainException raise(final Kind kind, final String details) {
        return new HookError(kind, details).toException();
    }
}
