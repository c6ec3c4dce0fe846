package com.bit.vault.vault;

import com.bit.vault.common.Address;
import lombok.Data;

import java.math.BigInteger;

@Data
public class VaultSnapshot {
    private final Address vault;
    private final Address feeRecipient;
    private final int feePercent;
    private final boolean ownSideIncomeEscrow;
    private final BigInteger totalShares;
    private final BigInteger freeShares;
    private final BigInteger queuedShares;
    private final BigInteger totalAssets;
    private final BigInteger liquidBalance;
    private final BigInteger availableAssets;
    private final BigInteger unclaimedAssets;
    private final BigInteger totalTicketsIssued;
    private final int checkpointCount;
    private final boolean collateralized;

    public static VaultSnapshot of(VaultLedger ledger, boolean collateralized) {
        return new VaultSnapshot(
                ledger.getVault(),
                ledger.getFeeRecipient(),
                ledger.getFeePercent(),
                ledger.isOwnSideIncomeEscrow(),
                ledger.getTotalShares(),
                ledger.getFreeShares().getAmount(),
                ledger.getExitQueue().getQueuedShares().getAmount(),
                ledger.getTotalAssets(),
                ledger.getLiquidBalance(),
                ledger.getAvailableAssets(),
                ledger.getExitQueue().getUnclaimedAssets(),
                ledger.getExitQueue().getTotalTicketsIssued(),
                ledger.getExitQueue().getCheckpoints().size(),
                collateralized);
    }
}
