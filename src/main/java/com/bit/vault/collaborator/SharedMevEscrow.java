package com.bit.vault.collaborator;

import com.bit.vault.common.Address;
import com.bit.vault.common.VaultMath;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 所有共享托管金库共用的一个资金池，按预言机证明的解锁额度拨付
 */
@Slf4j
@Component
public class SharedMevEscrow implements MevEscrow {

    private BigInteger balance = BigInteger.ZERO;

    @Override
    public synchronized void receive(Address vault, BigInteger amount) {
        balance = VaultMath.checkUint256(balance.add(amount), "shared escrow balance");
    }

    @Override
    public synchronized BigInteger harvest(Address vault, BigInteger amount) {
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (balance.compareTo(amount) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                    "共享托管余额 " + balance + " 不足以释放 " + amount);
        }
        balance = balance.subtract(amount);
        log.debug("共享托管向金库 {} 释放 {}", vault, amount);
        return amount;
    }

    @Override
    public synchronized BigInteger balanceOf(Address vault) {
        return balance;
    }
}
