// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.clmm.model;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 20-byte account, token or extension identifier. Ordered as an unsigned big-endian number.
 */
public final class Address implements Comparable<Address> {

    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Address of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("address must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Address(bytes.clone());
    }

    /**
     * Parses a 40-digit hex string, with or without a {@code 0x} prefix.
     */
    public static Address of(String hex) {
        Objects.requireNonNull(hex, "hex");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("address must be " + LENGTH * 2 + " hex digits: " + hex);
        }
        return new Address(HEX.parseHex(digits));
    }

    /**
     * Address whose numeric value is {@code value}; handy for fixtures.
     */
    public static Address fromLong(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("address value must be non-negative: " + value);
        }
        byte[] raw = BigInteger.valueOf(value).toByteArray();
        byte[] padded = new byte[LENGTH];
        int length = Math.min(raw.length, LENGTH);
        System.arraycopy(raw, raw.length - length, padded, LENGTH - length, length);
        return new Address(padded);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        return Arrays.equals(bytes, ((Address) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "0x" + HEX.formatHex(bytes);
    }
}
