// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

/**
 * Extension for pools created without one.
 */
public final class NoOpHook implements Hook {

    @Override
    public String toString() {
        return "NoOpHook";
    }
}
