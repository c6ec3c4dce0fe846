package com.bit.vault.vault;

import lombok.Data;

import java.math.BigInteger;

/**
 * 一次收割并推进退出队列的结果
 */
@Data
public class HarvestSettlement {
    private final boolean harvested;
    private final long nonce;
    // 计入总资产的增量（自持托管金库包含其托管中的旁路收入）
    private final BigInteger totalAssetsDelta;
    // 转入金库流动资产的旁路收入
    private final BigInteger sideIncome;
    private final BigInteger feeShares;
    private final BigInteger sharesBurned;
    private final BigInteger assetsReleased;
    private final int checkpointIndex;
}
