package com.bit.vault.keeper;

import com.bit.vault.common.RewardsRootHash;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.Keccak;

import java.math.BigInteger;

/**
 * 收益根更新的签名消息（类型化数据风格摘要）
 * digest = keccak256(0x1901 ‖ domainSeparator ‖ structHash)
 */
public final class RewardsAttestation {

    private static final byte[] DOMAIN_TYPE_HASH =
            Keccak.keccak256("EIP712Domain(string name,string version,uint256 chainId)");
    private static final byte[] REWARDS_TYPE_HASH = Keccak.keccak256(
            "KeeperRewards(bytes32 rewardsRoot,bytes32 rewardsIpfsHash,uint256 avgRewardPerSecond,uint64 updateTimestamp,uint64 nonce)");
    private static final byte[] DOMAIN_NAME = Keccak.keccak256("VaultKeeper");
    private static final byte[] DOMAIN_VERSION = Keccak.keccak256("1");

    private RewardsAttestation() {
    }

    public static byte[] domainSeparator(long chainId) {
        return Keccak.keccak256(DOMAIN_TYPE_HASH, DOMAIN_NAME, DOMAIN_VERSION, ByteUtils.toWord(chainId));
    }

    /**
     * @param nonce 更新前的收益根序号
     */
    public static byte[] digest(long chainId, RewardsRootHash rewardsRoot, String rewardsIpfsHash,
                                BigInteger avgRewardPerSecond, long updateTimestamp, long nonce) {
        byte[] structHash = Keccak.keccak256(
                REWARDS_TYPE_HASH,
                rewardsRoot.getBytes(),
                Keccak.keccak256(rewardsIpfsHash == null ? "" : rewardsIpfsHash),
                ByteUtils.toWord(avgRewardPerSecond),
                ByteUtils.toWord(updateTimestamp),
                ByteUtils.toWord(nonce));
        return Keccak.keccak256(new byte[]{0x19, 0x01}, domainSeparator(chainId), structHash);
    }
}
