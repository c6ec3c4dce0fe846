package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;
import java.util.List;

/**
 * 收割请求，哈希与证明节点均为 0x 开头的十六进制
 */
@Data
public class HarvestRequest {
    private String vault;
    private String rewardsRoot;
    private BigInteger reward;
    private BigInteger unlockedSideIncome;
    private List<String> proof;
}
