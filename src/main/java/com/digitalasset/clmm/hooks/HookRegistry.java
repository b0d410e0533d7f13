// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.common.errors.HookError;
import com.digitalasset.clmm.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Extensions by address. The zero address always resolves to a no-op extension.
 */
@Component
public class HookRegistry {

    private static final Logger logger = LoggerFactory.getLogger(HookRegistry.class);

    private final HookHandle noOp = new HookHandle(new NoOpHook(), HookCapabilities.none());
    private final Map<Address, HookHandle> handles = new ConcurrentHashMap<>();

    /**
     * Registers an extension. Pools already created keep the handle they resolved at
     * creation time.
     */
    public HookHandle register(Address address, Hook hook, HookCapabilities capabilities) {
        if (address.isZero()) {
            throw HookError.raise(HookError.Kind.INVALID_CAPABILITIES,
                "the zero address is reserved for pools without an extension");
        }
        HookHandle handle = new HookHandle(hook, capabilities);
        HookHandle previous = handles.put(address, handle);
        if (previous != null) {
            logger.warn("Replaced extension at {}: {} -> {}", address, previous.hook(), hook);
        } else {
            logger.info("Registered extension {} at {} with {}", hook, address, capabilities);
        }
        return handle;
    }

    /**
     * @throws com.digitalasset.clmm.common.DomainException HOOK_NOT_REGISTERED for an unknown
     *         non-zero address
     */
    public HookHandle resolve(Address address) {
        if (address.isZero()) {
            return noOp;
        }
        HookHandle handle = handles.get(address);
        if (handle == null) {
            throw HookError.raise(HookError.Kind.HOOK_NOT_REGISTERED, "no extension registered at " + address);
        }
        return handle;
    }

    public boolean isRegistered(Address address) {
        return address.isZero() || handles.containsKey(address);
    }
}
