package com.bit.vault.common;

import com.bit.vault.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.primitives.UnsignedBytes;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;

/**
 * 20字节账户地址（金库、份额持有人、预言机签名者）
 * 按无符号字节序比较：签名者必须按该顺序严格升序提交
 */
public final class Address implements Comparable<Address>, Serializable {
    public static final int ADDRESS_LENGTH = 20;

    public static final Address ZERO = new Address(new byte[ADDRESS_LENGTH]);

    private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();

    private final byte[] value;
    private final String hexValue;

    private Address(byte[] value) {
        if (value == null || value.length != ADDRESS_LENGTH) {
            throw new IllegalArgumentException("Address must be " + ADDRESS_LENGTH + " bytes");
        }
        this.value = Arrays.copyOf(value, ADDRESS_LENGTH);
        this.hexValue = "0x" + ByteUtils.bytesToHex(this.value);
    }

    public static Address fromBytes(byte[] value) {
        return new Address(value);
    }

    @JsonCreator
    public static Address fromHex(String hex) {
        return new Address(ByteUtils.hexToBytes(hex));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(value, ADDRESS_LENGTH);
    }

    @JsonValue
    public String toHex() {
        return hexValue;
    }

    @Override
    public int compareTo(Address other) {
        return ORDER.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((Address) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return hexValue;
    }
}
