package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;

/**
 * k-of-n 签名校验：消息必须由签名者集合中至少 minSigners 个不同成员签署
 * 纯函数，无副作用
 */
@Slf4j
@Component
public class AttestationVerifier {

    /**
     * 校验打包签名
     * @param message 32字节消息摘要
     * @param signatures 定宽65字节签名记录的拼接，签名者地址必须严格升序
     * @param minSigners 最少签名者数量
     * @param signerSet 合法签名者集合
     * @throws VaultException NOT_ENOUGH_SIGNATURES / INVALID_SIGNATURE / INVALID_ORACLES
     */
    public void verify(byte[] message, byte[] signatures, int minSigners, Set<Address> signerSet) {
        if (minSigners <= 0) {
            throw new VaultException(ErrorType.INVALID_ORACLES, "minSigners必须大于0");
        }
        if (signatures == null || signatures.length % Secp256k1Signer.SIGNATURE_LENGTH != 0) {
            throw new VaultException(ErrorType.INVALID_SIGNATURE, "签名长度必须是65字节的整数倍");
        }
        int count = signatures.length / Secp256k1Signer.SIGNATURE_LENGTH;
        if (count < minSigners) {
            throw new VaultException(ErrorType.NOT_ENOUGH_SIGNATURES,
                    "签名数量 " + count + " 少于要求的 " + minSigners);
        }

        // 升序要求让去重只需和上一个比较
        Address last = null;
        for (int i = 0; i < count; i++) {
            int start = i * Secp256k1Signer.SIGNATURE_LENGTH;
            byte[] record = Arrays.copyOfRange(signatures, start, start + Secp256k1Signer.SIGNATURE_LENGTH);
            Address signer = Secp256k1Signer.recoverAddress(message, record);
            if (signer == null) {
                throw new VaultException(ErrorType.INVALID_SIGNATURE, "第" + i + "个签名无法恢复签名者");
            }
            if (!signerSet.contains(signer)) {
                throw new VaultException(ErrorType.INVALID_SIGNATURE, "未知签名者: " + signer);
            }
            if (last != null && signer.compareTo(last) <= 0) {
                throw new VaultException(ErrorType.INVALID_SIGNATURE, "签名者重复或未按升序排列: " + signer);
            }
            last = signer;
        }
        log.debug("签名校验通过，签名数量: {}", count);
    }
}
