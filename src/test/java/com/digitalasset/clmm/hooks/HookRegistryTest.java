// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.hooks;

import com.digitalasset.clmm.common.DomainException;
import com.digitalasset.clmm.model.Address;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HookRegistryTest {

    private static final Address HOOK_ADDRESS = Address.fromLong(0xF00);

    private HookRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HookRegistry();
    }

    @Test
    void testZeroAddress_resolvesToNoOp() {
        HookHandle handle = registry.resolve(Address.ZERO);

        assertThat(handle.hook()).isInstanceOf(NoOpHook.class);
        assertThat(handle.capabilities().isEmpty()).isTrue();
        assertThat(registry.isRegistered(Address.ZERO)).isTrue();
    }

    @Test
    void testUnknownAddress_isRejected() {
        assertThat(registry.isRegistered(HOOK_ADDRESS)).isFalse();
        assertThatThrownBy(() -> registry.resolve(HOOK_ADDRESS))
            .isInstanceOfSatisfying(DomainException.class, e -> assertThat(e.code()).isEqualTo("HOOK_NOT_REGISTERED"));
    }

    @Test
    void testRegister_thenResolve() {
        DynamicFeeHook hook = new DynamicFeeHook(3000, 500, 10_000);

        HookHandle registered = registry.register(HOOK_ADDRESS, hook, DynamicFeeHook.capabilities());

        assertThat(registry.resolve(HOOK_ADDRESS)).isSameAs(registered);
        assertThat(registered.hook()).isSameAs(hook);
        assertThat(registry.isRegistered(HOOK_ADDRESS)).isTrue();
    }

    @Test
    void testRegister_replacesPreviousExtension() {
        registry.register(HOOK_ADDRESS, new NoOpHook(), HookCapabilities.none());
        HookHandle replacement = registry.register(HOOK_ADDRESS, new NoOpHook(), HookCapabilities.of(HookCallback.AFTER_DONATE));

        assertThat(registry.resolve(HOOK_ADDRESS)).isSameAs(replacement);
    }

    @Test
    void testRegister_zeroAddressIsReserved() {
        assertThatThrownBy(() -> registry.register(Address.ZERO, new NoOpHook(), HookCapabilities.none()))
            .isInstanceOfSatisfying(DomainException.class, e -> assertThat(e.code()).isEqualTo("INVALID_CAPABILITIES"));
    }
}
