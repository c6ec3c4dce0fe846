package com.bit.vault.common;

import com.bit.vault.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节哈希的通用基类，封装共同逻辑（长度校验、不可变性、十六进制转换）
 * 具体哈希类型（如收益根）应继承此类
 */
@EqualsAndHashCode(of = "value")
public abstract class ByteHash32 implements Serializable {
    public static final int HASH_LENGTH = 32;

    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    @Getter(AccessLevel.PROTECTED)
    private final String hexValue;

    /**
     * 由子类调用，强制校验长度
     * @param value 32字节哈希的原始字节数组
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH);
        this.hexValue = "0x" + ByteUtils.bytesToHex(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 0x前缀的小写十六进制
     */
    @JsonValue
    public String toHex() {
        return hexValue;
    }

    /**
     * 判断是否为零哈希（全0字节）
     */
    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 十六进制字符串转32字节（供子类工厂方法调用）
     */
    protected static byte[] parseHex(String hex) {
        byte[] bytes = ByteUtils.hexToBytes(hex);
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Invalid hex string length for 32-byte hash: " + hex);
        }
        return bytes;
    }

    @Override
    public String toString() {
        return hexValue;
    }
}
