package com.bit.vault.keeper;

import lombok.Data;

import java.math.BigInteger;

/**
 * 金库最近一次被计入的累计值与对应 nonce
 * 收益记录的 value 为有符号累计收益；旁路收入记录的 value 为累计已解锁旁路收入
 */
@Data
public class RewardRecord {
    public static final RewardRecord EMPTY = new RewardRecord(BigInteger.ZERO, 0L);

    private final BigInteger value;
    private final long nonce;
}
