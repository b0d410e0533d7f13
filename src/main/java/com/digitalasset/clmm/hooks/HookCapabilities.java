// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.common.errors.HookError;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of callbacks an extension has opted into.
 */
public final class HookCapabilities {

    private static final HookCapabilities NONE = new HookCapabilities(EnumSet.noneOf(HookCallback.class));

    private final Set<HookCallback> enabled;

    private HookCapabilities(EnumSet<HookCallback> enabled) {
        this.enabled = Collections.unmodifiableSet(enabled);
    }

    public static HookCapabilities none() {
        return NONE;
    }

    /**
     * @throws com.digitalasset.clmm.common.DomainException INVALID_CAPABILITIES when a
     *         returns-delta flag is set without its callback
     */
    public static HookCapabilities of(HookCallback... callbacks) {
        EnumSet<HookCallback> set = EnumSet.noneOf(HookCallback.class);
        Collections.addAll(set, callbacks);
        for (HookCallback callback : set) {
            if (callback.requires() != null && !set.contains(callback.requires())) {
                throw HookError.raise(HookError.Kind.INVALID_CAPABILITIES,
                    callback + " requires " + callback.requires());
            }
        }
        return new HookCapabilities(set);
    }

    public boolean isEnabled(HookCallback callback) {
        return enabled.contains(callback);
    }

    public boolean isEmpty() {
        return enabled.isEmpty();
    }

    public Set<HookCallback> enabled() {
        return enabled;
    }

    @Override
    public String toString() {
        return "HookCapabilities" + enabled;
    }
}
