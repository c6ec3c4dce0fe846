package com.bit.vault.util;

import com.bit.vault.common.Address;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 可恢复签名（65字节 r‖s‖v）：签名与从签名恢复签名者地址
 * 地址 = keccak256(非压缩公钥去掉0x04前缀) 的后20字节
 */
@Slf4j
public class Secp256k1Signer {

    public static final int SIGNATURE_LENGTH = 65;

    private static final BigInteger CURVE_ORDER = ECKey.CURVE.getN();
    // 只接受低 s 值，避免签名延展性（同一签名者两条不同签名）
    private static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    /**
     * 对32字节摘要签名
     * @param key 私钥
     * @param digest 32字节摘要（不再二次哈希）
     * @return 65字节签名 r(32)‖s(32)‖v(1)，v ∈ {27, 28}
     */
    public static byte[] sign(ECKey key, byte[] digest) {
        if (digest.length != 32) {
            throw new IllegalArgumentException("摘要必须为32字节");
        }
        Sha256Hash message = Sha256Hash.wrap(digest);
        // bitcoinj 的签名已规范化为低 s
        ECKey.ECDSASignature sig = key.sign(message);
        int recId = -1;
        for (int i = 0; i < 2; i++) {
            ECKey recovered = ECKey.recoverFromSignature(i, sig, message, false);
            if (recovered != null && recovered.getPubKeyPoint().equals(key.getPubKeyPoint())) {
                recId = i;
                break;
            }
        }
        if (recId == -1) {
            throw new IllegalStateException("无法确定签名恢复标识");
        }
        return ByteUtils.concat(
                ByteUtils.toWord(sig.r),
                ByteUtils.toWord(sig.s),
                new byte[]{(byte) (27 + recId)});
    }

    /**
     * 从签名恢复签名者地址
     * @return 签名者地址；签名格式非法或无法恢复时返回 null
     */
    public static Address recoverAddress(byte[] digest, byte[] signature) {
        if (digest.length != 32 || signature.length != SIGNATURE_LENGTH) {
            return null;
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int v = signature[64] & 0xFF;
        int recId = v >= 27 ? v - 27 : v;
        if (recId < 0 || recId > 1) {
            return null;
        }
        if (r.signum() == 0 || r.compareTo(CURVE_ORDER) >= 0 || s.signum() == 0 || s.compareTo(HALF_CURVE_ORDER) > 0) {
            return null;
        }
        try {
            ECKey recovered = ECKey.recoverFromSignature(recId, new ECKey.ECDSASignature(r, s), Sha256Hash.wrap(digest), false);
            return recovered == null ? null : toAddress(recovered);
        } catch (IllegalArgumentException e) {
            log.debug("签名恢复失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 公钥对应的20字节地址
     */
    public static Address toAddress(ECKey key) {
        byte[] pub = key.getPubKeyPoint().getEncoded(false);
        byte[] hash = Keccak.keccak256(Arrays.copyOfRange(pub, 1, pub.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, hash.length - Address.ADDRESS_LENGTH, hash.length));
    }
}
