package com.bit.vault.keeper;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRootHash;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class RewardsTreeTest {

    private static Address vault(int i) {
        byte[] bytes = new byte[20];
        bytes[19] = (byte) i;
        bytes[0] = (byte) (0x10 * i);
        return Address.fromBytes(bytes);
    }

    private static RewardsTree.VaultReward reward(int i, long reward, long sideIncome) {
        return new RewardsTree.VaultReward(vault(i), BigInteger.valueOf(reward), BigInteger.valueOf(sideIncome));
    }

    @Test
    void everyLeafProvesAgainstRoot() {
        for (int size = 1; size <= 7; size++) {
            List<RewardsTree.VaultReward> rewards = new ArrayList<>();
            for (int i = 1; i <= size; i++) {
                rewards.add(reward(i, i * 1_000L - 2_500L, i * 10L));
            }
            RewardsTree tree = RewardsTree.build(rewards);
            RewardsRootHash root = tree.getRoot();
            for (RewardsTree.VaultReward r : rewards) {
                byte[] leaf = RewardLeaf.hash(r.getVault(), r.getReward(), r.getUnlockedSideIncome());
                assertTrue(MerkleProofs.verify(tree.getProof(r), root.getBytes(), leaf), "size " + size + " " + r);
            }
            log.info("叶子数 {} 收益根 {}", size, root);
        }
    }

    @Test
    void singleLeafRootIsLeaf() {
        RewardsTree.VaultReward r = reward(1, 100, 0);
        RewardsTree tree = RewardsTree.build(Collections.singletonList(r));
        assertArrayEquals(RewardLeaf.hash(r.getVault(), r.getReward(), r.getUnlockedSideIncome()), tree.getRoot().getBytes());
        assertTrue(tree.getProof(r).isEmpty());
    }

    @Test
    void tamperedLeafFails() {
        List<RewardsTree.VaultReward> rewards = List.of(reward(1, 100, 0), reward(2, 200, 5), reward(3, -50, 0));
        RewardsTree tree = RewardsTree.build(rewards);
        List<byte[]> proof = tree.getProof(rewards.get(1));
        byte[] forged = RewardLeaf.hash(vault(2), BigInteger.valueOf(201), BigInteger.valueOf(5));
        assertFalse(MerkleProofs.verify(proof, tree.getRoot().getBytes(), forged));
        byte[] otherVault = RewardLeaf.hash(vault(4), BigInteger.valueOf(200), BigInteger.valueOf(5));
        assertFalse(MerkleProofs.verify(proof, tree.getRoot().getBytes(), otherVault));
    }

    @Test
    void pairHashIsOrderIndependent() {
        byte[] a = RewardLeaf.hash(vault(1), BigInteger.ONE, BigInteger.ZERO);
        byte[] b = RewardLeaf.hash(vault(2), BigInteger.ONE, BigInteger.ZERO);
        assertArrayEquals(MerkleProofs.hashPair(a, b), MerkleProofs.hashPair(b, a));
    }

    @Test
    void leafRejectsOutOfRangeValues() {
        BigInteger tooLarge = BigInteger.ONE.shiftLeft(191);
        assertThrows(VaultException.class, () -> RewardLeaf.hash(vault(1), tooLarge, BigInteger.ZERO));
        assertThrows(VaultException.class, () -> RewardLeaf.hash(vault(1), BigInteger.ZERO, BigInteger.ONE.negate()));
    }
}
