package com.bit.vault.keeper;

import lombok.Data;

import java.math.BigInteger;

/**
 * 收割结果。harvested=false 表示针对已计入或更旧的根重复收割，增量均为0
 */
@Data
public class HarvestResult {
    private final BigInteger rewardDelta;
    private final BigInteger sideIncomeDelta;
    private final long nonce;
    private final boolean harvested;

    public static HarvestResult noop(long nonce) {
        return new HarvestResult(BigInteger.ZERO, BigInteger.ZERO, nonce, false);
    }
}
