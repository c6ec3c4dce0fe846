package com.bit.vault.keeper;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRootHash;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedBytes;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 收益表默克尔树构建器（预言机侧工具）：由各金库累计收益生成收益根与证明
 * 叶子按字节序排序；奇数层最后一个节点直接上提
 */
public class RewardsTree {

    private final List<byte[]> leaves;
    private final List<List<byte[]>> layers = new ArrayList<>();

    private RewardsTree(List<byte[]> sortedLeaves) {
        this.leaves = sortedLeaves;
        layers.add(sortedLeaves);
        List<byte[]> level = sortedLeaves;
        while (level.size() > 1) {
            List<byte[]> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                if (i + 1 < level.size()) {
                    next.add(MerkleProofs.hashPair(level.get(i), level.get(i + 1)));
                } else {
                    next.add(level.get(i));
                }
            }
            layers.add(next);
            level = next;
        }
    }

    public static RewardsTree build(List<VaultReward> rewards) {
        if (rewards == null || rewards.isEmpty()) {
            throw new IllegalArgumentException("收益表不能为空");
        }
        List<byte[]> hashed = new ArrayList<>(rewards.size());
        for (VaultReward r : rewards) {
            hashed.add(RewardLeaf.hash(r.getVault(), r.getReward(), r.getUnlockedSideIncome()));
        }
        hashed.sort(UnsignedBytes.lexicographicalComparator());
        return new RewardsTree(hashed);
    }

    public RewardsRootHash getRoot() {
        return RewardsRootHash.fromBytes(layers.get(layers.size() - 1).get(0));
    }

    public List<byte[]> getProof(VaultReward reward) {
        byte[] leaf = RewardLeaf.hash(reward.getVault(), reward.getReward(), reward.getUnlockedSideIncome());
        int index = -1;
        for (int i = 0; i < leaves.size(); i++) {
            if (Arrays.equals(leaves.get(i), leaf)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("收益表中不存在该叶子: " + reward);
        }
        ImmutableList.Builder<byte[]> proof = ImmutableList.builder();
        for (int depth = 0; depth < layers.size() - 1; depth++) {
            List<byte[]> level = layers.get(depth);
            int sibling = (index % 2 == 0) ? index + 1 : index - 1;
            if (sibling < level.size()) {
                proof.add(level.get(sibling));
            }
            index /= 2;
        }
        return proof.build();
    }

    /**
     * 单个金库的累计收益条目
     */
    @Data
    public static class VaultReward {
        private final Address vault;
        private final BigInteger reward;
        private final BigInteger unlockedSideIncome;
    }
}
