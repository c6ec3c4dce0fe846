package com.bit.vault.journal;

import com.bit.vault.keeper.RewardConsensusLedger;
import com.bit.vault.oracle.OracleRegistry;
import com.bit.vault.vault.VaultService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 启动时按原顺序重放操作日志，经由与在线请求相同的服务方法重建状态
 * 检查点下标与凭证 offset 依赖位置，只能按序重放
 */
@Slf4j
@Component
public class JournalReplayer {

    @Autowired
    private VaultJournal journal;

    @Autowired
    private VaultService vaultService;

    @Autowired
    private RewardConsensusLedger rewardLedger;

    @Autowired
    private OracleRegistry oracleRegistry;

    @PostConstruct
    public void replay() {
        long start = System.currentTimeMillis();
        int replayed = journal.replay(this::apply);
        if (replayed > 0) {
            log.info("操作日志重放完成，条数: {}，耗时: {}ms", replayed, System.currentTimeMillis() - start);
        }
    }

    void apply(JournalEntry entry) {
        if (entry instanceof JournalEntry.VaultCreated) {
            JournalEntry.VaultCreated e = (JournalEntry.VaultCreated) entry;
            vaultService.createVault(e.getVault(), e.getFeeRecipient(), e.getFeePercent(),
                    e.isOwnSideIncomeEscrow(), e.getSecurityDeposit());
        } else if (entry instanceof JournalEntry.Deposited) {
            JournalEntry.Deposited e = (JournalEntry.Deposited) entry;
            vaultService.deposit(e.getVault(), e.getReceiver(), e.getAssets());
        } else if (entry instanceof JournalEntry.Redeemed) {
            JournalEntry.Redeemed e = (JournalEntry.Redeemed) entry;
            vaultService.redeem(e.getVault(), e.getOwner(), e.getShares());
        } else if (entry instanceof JournalEntry.PrincipalMoved) {
            JournalEntry.PrincipalMoved e = (JournalEntry.PrincipalMoved) entry;
            vaultService.onPrincipalMoved(e.getVault(), e.getAmountDelta());
        } else if (entry instanceof JournalEntry.SideIncomeReceived) {
            JournalEntry.SideIncomeReceived e = (JournalEntry.SideIncomeReceived) entry;
            vaultService.receiveSideIncome(e.getVault(), e.getAmount());
        } else if (entry instanceof JournalEntry.OracleAdded) {
            oracleRegistry.addOracle(oracleRegistry.getOwner(), ((JournalEntry.OracleAdded) entry).getOracle());
        } else if (entry instanceof JournalEntry.OracleRemoved) {
            oracleRegistry.removeOracle(oracleRegistry.getOwner(), ((JournalEntry.OracleRemoved) entry).getOracle());
        } else if (entry instanceof JournalEntry.MinOraclesUpdated) {
            oracleRegistry.setMinOracles(oracleRegistry.getOwner(), ((JournalEntry.MinOraclesUpdated) entry).getMinOracles());
        } else if (entry instanceof JournalEntry.RewardsUpdated) {
            rewardLedger.updateRewards(((JournalEntry.RewardsUpdated) entry).getParams());
        } else if (entry instanceof JournalEntry.Harvested) {
            JournalEntry.Harvested e = (JournalEntry.Harvested) entry;
            vaultService.harvestAndSettle(e.getParams(), e.getTimestamp());
        } else if (entry instanceof JournalEntry.ExitQueueEntered) {
            JournalEntry.ExitQueueEntered e = (JournalEntry.ExitQueueEntered) entry;
            vaultService.enterExitQueue(e.getVault(), e.getOwner(), e.getShares(), e.getTimestamp());
        } else if (entry instanceof JournalEntry.ExitTicketSettled) {
            JournalEntry.ExitTicketSettled e = (JournalEntry.ExitTicketSettled) entry;
            vaultService.settleExitTicket(e.getVault(), e.getCaller(), e.getTicketOffset(),
                    e.getCheckpointIndex(), e.getTimestamp());
        } else {
            throw new IllegalStateException("未知的操作日志类型: " + entry.getClass().getName());
        }
    }
}
