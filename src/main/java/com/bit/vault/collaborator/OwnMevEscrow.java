package com.bit.vault.collaborator;

import com.bit.vault.common.Address;
import com.bit.vault.common.VaultMath;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 金库自持的旁路收入托管，收割时余额全部转入金库并计入总资产
 */
@Slf4j
@Component
public class OwnMevEscrow implements MevEscrow {

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();

    @Override
    public void receive(Address vault, BigInteger amount) {
        balances.merge(vault, amount, (a, b) -> VaultMath.checkUint256(a.add(b), "own escrow balance"));
    }

    @Override
    public BigInteger harvest(Address vault, BigInteger amount) {
        if (amount.signum() == 0) {
            return BigInteger.ZERO;
        }
        balances.compute(vault, (key, balance) -> {
            if (balance == null || balance.compareTo(amount) < 0) {
                throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                        "金库 " + vault + " 自持托管余额 " + balance + " 不足以转出 " + amount);
            }
            BigInteger left = balance.subtract(amount);
            return left.signum() == 0 ? null : left;
        });
        log.debug("金库 {} 自持托管转出 {}", vault, amount);
        return amount;
    }

    @Override
    public BigInteger balanceOf(Address vault) {
        return balances.getOrDefault(vault, BigInteger.ZERO);
    }
}
