package com.bit.vault.exitqueue;

import lombok.Data;

import java.math.BigInteger;

@Data
public class AdvanceResult {
    public static final AdvanceResult EMPTY = new AdvanceResult(BigInteger.ZERO, BigInteger.ZERO, -1);

    private final BigInteger sharesBurned;
    private final BigInteger assetsReleased;
    // 新检查点下标，未生成检查点时为 -1
    private final int checkpointIndex;

    public boolean isEmpty() {
        return checkpointIndex < 0;
    }
}
