package com.bit.vault.util;

import org.bouncycastle.jcajce.provider.digest.Keccak.Digest256;

import java.nio.charset.StandardCharsets;

/**
 * keccak256 摘要（以太坊风格，非 NIST SHA3-256）
 */
public class Keccak {

    // 每个线程复用自己的实例
    private static final ThreadLocal<Digest256> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Digest256::new);

    public static byte[] keccak256(byte[] data) {
        data = data == null ? new byte[0] : data;
        Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段拼接后求摘要
     */
    public static byte[] keccak256(byte[]... parts) {
        Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return digest.digest();
    }

    public static byte[] keccak256(String utf8) {
        return keccak256(utf8.getBytes(StandardCharsets.UTF_8));
    }

}
