package com.bit.vault.exitqueue;

import lombok.Data;

import java.math.BigInteger;

/**
 * 退出队列检查点：截至该点累计销毁的份额与累计释放的资产（前缀和）
 */
@Data
public class Checkpoint {
    private final BigInteger cumulativeSharesBurned;
    private final BigInteger cumulativeAssetsReleased;
}
