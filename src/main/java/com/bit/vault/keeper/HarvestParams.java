package com.bit.vault.keeper;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRootHash;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * 收割参数：金库在某一代收益根下的累计收益叶子及其证明
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HarvestParams {
    private Address vault;
    private RewardsRootHash rewardsRoot;
    private BigInteger reward;
    private BigInteger unlockedSideIncome;
    private List<byte[]> proof;
}
