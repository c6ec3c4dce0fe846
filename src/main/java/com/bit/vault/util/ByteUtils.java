package com.bit.vault.util;

import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;

/**
 * 二进制统一大端
 */
public class ByteUtils {

    /**
     * long 转 8字节（大端）
     */
    public static byte[] longToBytes(long value) {
        byte[] bytes = new byte[8];
        for (int i = 0; i < 8; i++) {
            bytes[7 - i] = (byte) (value >>> (8 * i));
        }
        return bytes;
    }

    /**
     * 8字节（大端）转 long
     */
    public static long bytesToLong(byte[] bytes) {
        if (bytes.length != 8) {
            throw new IllegalArgumentException("字节数组必须为8字节");
        }
        long value = 0;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xFF);
        }
        return value;
    }

    /**
     * 整数编码为32字节字（有符号数用补码），与 abi.encode 的定宽字一致
     */
    public static byte[] toWord(BigInteger value) {
        byte[] raw = value.toByteArray();
        if (raw.length > 33 || (raw.length == 33 && raw[0] != 0)) {
            throw new IllegalArgumentException("数值超出256位: " + value);
        }
        byte[] word = new byte[32];
        if (value.signum() < 0) {
            java.util.Arrays.fill(word, (byte) 0xFF);
        }
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, word, 32 - copy, copy);
        return word;
    }

    public static byte[] toWord(long value) {
        return toWord(BigInteger.valueOf(value));
    }

    /**
     * 左侧补零到32字节（地址等短字节串）
     */
    public static byte[] leftPad32(byte[] bytes) {
        if (bytes.length > 32) {
            throw new IllegalArgumentException("超过32字节");
        }
        byte[] word = new byte[32];
        System.arraycopy(bytes, 0, word, 32 - bytes.length, bytes.length);
        return word;
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) {
            len += p.length;
        }
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    /**
     * 字节数组转十六进制字符串（无前缀）
     */
    public static String bytesToHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    /**
     * 十六进制字符串转字节数组，可带 0x 前缀
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex不能为空");
        }
        String h = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (h.length() % 2 != 0) {
            throw new IllegalArgumentException("hex长度必须为偶数: " + hex);
        }
        try {
            return Hex.decode(h);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("非法hex字符: " + hex, e);
        }
    }
}
