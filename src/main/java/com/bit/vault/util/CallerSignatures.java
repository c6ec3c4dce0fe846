package com.bit.vault.util;

import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;

/**
 * 调用者签名：管理操作与凭证结算由调用者对请求摘要签名，服务端恢复出调用者地址
 * digest = keccak256(0x1901 ‖ keccak256(keccak256("VaultCaller") ‖ chainId) ‖ keccak256(keccak256(action) ‖ words...))
 */
public final class CallerSignatures {

    private static final byte[] DOMAIN_NAME = Keccak.keccak256("VaultCaller");

    private CallerSignatures() {
    }

    /**
     * @param words 每个参数编码为32字节
     */
    public static byte[] digest(long chainId, String action, byte[]... words) {
        byte[] domain = Keccak.keccak256(DOMAIN_NAME, ByteUtils.toWord(chainId));
        byte[][] parts = new byte[words.length + 1][];
        parts[0] = Keccak.keccak256(action);
        System.arraycopy(words, 0, parts, 1, words.length);
        return Keccak.keccak256(new byte[]{0x19, 0x01}, domain, Keccak.keccak256(parts));
    }

    public static byte[] word(Address address) {
        return ByteUtils.leftPad32(address.getBytes());
    }

    /**
     * 恢复签名者，签名缺失或无效时拒绝
     */
    public static Address recover(byte[] digest, byte[] signature) {
        Address caller = signature == null ? null : Secp256k1Signer.recoverAddress(digest, signature);
        if (caller == null) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "调用者签名无效");
        }
        return caller;
    }
}
