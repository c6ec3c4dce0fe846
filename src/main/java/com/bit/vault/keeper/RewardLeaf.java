package com.bit.vault.keeper;

import com.bit.vault.common.Address;
import com.bit.vault.common.VaultMath;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.Keccak;

import java.math.BigInteger;

/**
 * 收益表叶子：keccak256(keccak256(vault ‖ int256(reward) ‖ uint256(sideIncome)))
 * 叶子总是编码累计值而不是增量
 */
public final class RewardLeaf {

    private RewardLeaf() {
    }

    public static byte[] hash(Address vault, BigInteger reward, BigInteger unlockedSideIncome) {
        VaultMath.checkInt192(reward, "reward");
        VaultMath.checkUint192(unlockedSideIncome, "unlockedSideIncome");
        byte[] encoded = ByteUtils.concat(
                ByteUtils.leftPad32(vault.getBytes()),
                ByteUtils.toWord(reward),
                ByteUtils.toWord(unlockedSideIncome));
        // 双重哈希，叶子不可能与内部节点碰撞
        return Keccak.keccak256(Keccak.keccak256(encoded));
    }
}
