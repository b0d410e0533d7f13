// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.model;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 32-byte discriminator that lets one owner hold several positions on the same range.
 */
public final class Salt {

    public static final int LENGTH = 32;
    public static final Salt ZERO = new Salt(new byte[LENGTH]);

    private final byte[] bytes;

    private Salt(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Salt of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("salt must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Salt(bytes.clone());
    }

    public static Salt of(long value) {
        byte[] padded = new byte[LENGTH];
        ByteBuffer.wrap(padded, LENGTH - Long.BYTES, Long.BYTES).putLong(value);
        return new Salt(padded);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Salt)) return false;
        return Arrays.equals(bytes, ((Salt) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "0x" + HexFormat.of().formatHex(bytes);
    }
}
