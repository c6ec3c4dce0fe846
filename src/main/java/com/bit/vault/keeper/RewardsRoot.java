package com.bit.vault.keeper;

import com.bit.vault.common.RewardsRootHash;
import lombok.Data;

import java.math.BigInteger;

/**
 * 收益根的两代版本值：当前根与上一代根（只保留一代历史）
 * 每次更新 nonce 加一；当前根对应 nonce，上一代根对应 nonce - 1
 */
@Data
public class RewardsRoot {
    private final RewardsRootHash root;
    private final RewardsRootHash prevRoot;
    private final long nonce;
    private final long lastUpdateTimestamp;
    private final BigInteger avgRewardPerSecond;

    public static RewardsRoot initial() {
        return new RewardsRoot(RewardsRootHash.ZERO, RewardsRootHash.ZERO, 0L, 0L, BigInteger.ZERO);
    }

    /**
     * 当前根下移为上一代，安装新根
     */
    public RewardsRoot advance(RewardsRootHash newRoot, long updateTimestamp, BigInteger avgRate) {
        return new RewardsRoot(newRoot, root, nonce + 1, updateTimestamp, avgRate);
    }

    /**
     * 给定根对应的 nonce；不是最近两代之一时返回 -1
     */
    public long nonceOf(RewardsRootHash candidate) {
        if (candidate == null || candidate.isZero()) {
            return -1;
        }
        if (candidate.equals(root)) {
            return nonce;
        }
        if (candidate.equals(prevRoot)) {
            return nonce - 1;
        }
        return -1;
    }
}
