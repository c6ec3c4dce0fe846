package com.bit.vault.oracle;

import com.bit.vault.OracleFixture;
import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.Keccak;
import com.bit.vault.util.Secp256k1Signer;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class AttestationVerifierTest {

    private final AttestationVerifier verifier = new AttestationVerifier();
    private final OracleFixture oracles = new OracleFixture(3);
    private final Set<Address> signerSet = new HashSet<>(oracles.addresses());
    private final byte[] message = Keccak.keccak256("rewards update");

    @Test
    void quorumOfAscendingSignersPasses() {
        verifier.verify(message, oracles.sign(message, 0, 1), 2, signerSet);
        verifier.verify(message, oracles.sign(message, 0, 1, 2), 2, signerSet);
        verifier.verify(message, oracles.sign(message, 1, 2), 2, signerSet);
    }

    @Test
    void recoversSignerAddress() {
        byte[] signature = oracles.sign(message, 0);
        assertEquals(Secp256k1Signer.SIGNATURE_LENGTH, signature.length);
        assertEquals(oracles.addresses().get(0), Secp256k1Signer.recoverAddress(message, signature));
    }

    @Test
    void tooFewSignatures() {
        assertError(ErrorType.NOT_ENOUGH_SIGNATURES,
                () -> verifier.verify(message, oracles.sign(message, 0), 2, signerSet));
        assertError(ErrorType.NOT_ENOUGH_SIGNATURES,
                () -> verifier.verify(message, new byte[0], 1, signerSet));
    }

    @Test
    void unknownSignerRejected() {
        ECKey outsider = ECKey.fromPrivate(BigInteger.valueOf(424242));
        byte[] signatures = ByteUtils.concat(oracles.sign(message, 0), Secp256k1Signer.sign(outsider, message));
        // 按地址顺序可能在前也可能在后，两种排列都必须被拒绝
        assertError(ErrorType.INVALID_SIGNATURE, () -> verifier.verify(message, signatures, 2, signerSet));
        byte[] reversed = ByteUtils.concat(Secp256k1Signer.sign(outsider, message), oracles.sign(message, 0));
        assertError(ErrorType.INVALID_SIGNATURE, () -> verifier.verify(message, reversed, 2, signerSet));
    }

    @Test
    void repeatedOrUnorderedSignersRejected() {
        assertError(ErrorType.INVALID_SIGNATURE,
                () -> verifier.verify(message, oracles.sign(message, 0, 0), 2, signerSet));
        assertError(ErrorType.INVALID_SIGNATURE,
                () -> verifier.verify(message, oracles.sign(message, 1, 0), 2, signerSet));
    }

    @Test
    void signatureOverOtherMessageRejected() {
        byte[] other = Keccak.keccak256("another update");
        assertError(ErrorType.INVALID_SIGNATURE,
                () -> verifier.verify(message, oracles.sign(other, 0, 1), 2, signerSet));
    }

    @Test
    void malformedRecordsRejected() {
        byte[] signatures = oracles.sign(message, 0, 1);
        assertError(ErrorType.INVALID_SIGNATURE,
                () -> verifier.verify(message, Arrays.copyOf(signatures, 100), 1, signerSet));

        byte[] badV = signatures.clone();
        badV[64] = 30;
        assertError(ErrorType.INVALID_SIGNATURE, () -> verifier.verify(message, badV, 2, signerSet));

        // 高 s 值（s' = n - s）是同一签名者的延展签名
        byte[] highS = Arrays.copyOf(signatures, 65);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(highS, 32, 64));
        byte[] flipped = ByteUtils.toWord(ECKey.CURVE.getN().subtract(s));
        System.arraycopy(flipped, 0, highS, 32, 32);
        highS[64] = (byte) (highS[64] == 27 ? 28 : 27);
        assertNull(Secp256k1Signer.recoverAddress(message, highS));
        assertError(ErrorType.INVALID_SIGNATURE, () -> verifier.verify(message, highS, 1, signerSet));
    }

    @Test
    void nonPositiveQuorumRejected() {
        assertError(ErrorType.INVALID_ORACLES,
                () -> verifier.verify(message, oracles.sign(message, 0), 0, signerSet));
    }

    private static void assertError(ErrorType expected, Runnable action) {
        VaultException e = assertThrows(VaultException.class, action::run);
        log.info("{}", e.getMessage());
        assertEquals(expected, e.getErrorType());
    }
}
