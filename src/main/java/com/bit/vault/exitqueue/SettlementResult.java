package com.bit.vault.exitqueue;

import lombok.Data;

import java.math.BigInteger;

/**
 * 结算结果；remainingTicket 为 null 表示凭证已全部结算
 */
@Data
public class SettlementResult {
    private final BigInteger exitedShares;
    private final BigInteger exitedAssets;
    private final ExitTicket remainingTicket;

    public boolean isFullySettled() {
        return remainingTicket == null;
    }
}
