package com.bit.vault.collaborator;

import com.bit.vault.common.Address;

import java.math.BigInteger;

/**
 * 旁路收入（MEV）托管
 */
public interface MevEscrow {

    /**
     * 收到旁路收入
     */
    void receive(Address vault, BigInteger amount);

    /**
     * 向金库转出指定金额，余额不足时拒绝
     * @return 转出的金额
     */
    BigInteger harvest(Address vault, BigInteger amount);

    BigInteger balanceOf(Address vault);
}
