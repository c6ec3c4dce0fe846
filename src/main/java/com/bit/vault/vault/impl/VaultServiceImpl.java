package com.bit.vault.vault.impl;

import com.bit.vault.collaborator.MevEscrow;
import com.bit.vault.collaborator.OwnMevEscrow;
import com.bit.vault.collaborator.SharedMevEscrow;
import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.config.VaultProperties;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.exitqueue.AdvanceResult;
import com.bit.vault.exitqueue.Checkpoint;
import com.bit.vault.exitqueue.ExitTicket;
import com.bit.vault.exitqueue.SettlementResult;
import com.bit.vault.journal.JournalEntry;
import com.bit.vault.journal.VaultJournal;
import com.bit.vault.keeper.HarvestParams;
import com.bit.vault.keeper.HarvestResult;
import com.bit.vault.keeper.RewardConsensusLedger;
import com.bit.vault.vault.HarvestSettlement;
import com.bit.vault.vault.VaultLedger;
import com.bit.vault.vault.VaultService;
import com.bit.vault.vault.VaultSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

@Slf4j
@Service
public class VaultServiceImpl implements VaultService {

    @Autowired
    private VaultProperties properties;

    @Autowired
    private RewardConsensusLedger rewardLedger;

    @Autowired
    private VaultJournal journal;

    @Autowired
    private SharedMevEscrow sharedMevEscrow;

    @Autowired
    private OwnMevEscrow ownMevEscrow;

    private final Map<Address, VaultSlot> vaults = new ConcurrentHashMap<>();

    @Override
    public VaultSnapshot createVault(Address vault, Address feeRecipient, int feePercent,
                                     boolean ownSideIncomeEscrow) {
        return createVault(vault, feeRecipient, feePercent, ownSideIncomeEscrow, properties.getSecurityDeposit());
    }

    @Override
    public synchronized VaultSnapshot createVault(Address vault, Address feeRecipient, int feePercent,
                                                  boolean ownSideIncomeEscrow, BigInteger securityDeposit) {
        if (vault == null || feeRecipient == null) {
            throw new IllegalArgumentException("vault/feeRecipient cannot be null");
        }
        if (vaults.containsKey(vault)) {
            throw new VaultException(ErrorType.VAULT_EXISTS, "金库已存在: " + vault);
        }
        VaultLedger ledger = VaultLedger.create(vault, feeRecipient, feePercent, ownSideIncomeEscrow,
                securityDeposit,
                properties.getExitQueue().getClaimDelay(),
                properties.getExitQueue().getUpdateDelay());
        rewardLedger.registerVault(vault, ownSideIncomeEscrow);
        try {
            journal.record(new JournalEntry.VaultCreated(vault, feeRecipient, feePercent, ownSideIncomeEscrow, securityDeposit));
        } catch (RuntimeException e) {
            rewardLedger.deregisterVault(vault);
            throw e;
        }
        vaults.put(vault, new VaultSlot(ledger));
        log.info("金库已创建: {}，手续费: {}bps，接收人: {}，自持旁路托管: {}，安全保证金: {}",
                vault, feePercent, feeRecipient, ownSideIncomeEscrow, securityDeposit);
        return VaultSnapshot.of(ledger, false);
    }

    @Override
    public BigInteger deposit(Address vault, Address receiver, BigInteger assets) {
        return mutate(vault, staged -> {
            if (rewardLedger.isHarvestRequired(vault)) {
                throw new VaultException(ErrorType.NOT_HARVESTED, "金库 " + vault + " 需先收割");
            }
            BigInteger shares = staged.deposit(receiver, assets);
            journal.record(new JournalEntry.Deposited(vault, receiver, assets));
            log.info("金库 {} 存入: receiver={}, assets={}, shares={}", vault, receiver, assets, shares);
            return shares;
        });
    }

    @Override
    public BigInteger redeem(Address vault, Address owner, BigInteger shares) {
        return mutate(vault, staged -> {
            if (rewardLedger.isCollateralized(vault)) {
                throw new VaultException(ErrorType.COLLATERALIZED, "金库 " + vault + " 已抵押，请进入退出队列");
            }
            BigInteger assets = staged.redeem(owner, shares);
            journal.record(new JournalEntry.Redeemed(vault, owner, shares));
            log.info("金库 {} 即时赎回: owner={}, shares={}, assets={}", vault, owner, shares, assets);
            return assets;
        });
    }

    @Override
    public void receiveSideIncome(Address vault, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_ASSETS, "旁路收入必须大于0");
        }
        mutate(vault, staged -> {
            journal.record(new JournalEntry.SideIncomeReceived(vault, amount));
            escrowOf(staged).receive(vault, amount);
            log.info("金库 {} 收到旁路收入 {}", vault, amount);
            return null;
        });
    }

    @Override
    public void onPrincipalMoved(Address vault, BigInteger amountDelta) {
        if (amountDelta == null) {
            throw new VaultException(ErrorType.INVALID_ASSETS, "本金变动不能为空");
        }
        mutate(vault, staged -> {
            staged.movePrincipal(amountDelta);
            journal.record(new JournalEntry.PrincipalMoved(vault, amountDelta));
            log.info("金库 {} 本金变动 {}，流动资产: {}", vault, amountDelta, staged.getLiquidBalance());
            return null;
        });
    }

    @Override
    public HarvestSettlement harvestAndSettle(HarvestParams params, long now) {
        Address vault = params.getVault();
        // 回调在收益共识账本的读锁内执行，日志顺序与收割记录一致
        return mutate(vault, staged ->
                rewardLedger.harvest(vault, params, result -> applyHarvest(staged, params, result, now)));
    }

    private HarvestSettlement applyHarvest(VaultLedger staged, HarvestParams params, HarvestResult result, long now) {
        Address vault = staged.getVault();
        MevEscrow escrow = escrowOf(staged);
        BigInteger totalAssetsDelta = result.getRewardDelta();
        BigInteger sideIncome = BigInteger.ZERO;
        if (result.isHarvested()) {
            if (staged.isOwnSideIncomeEscrow()) {
                // 自持托管的收入不在收益树中，转入时计入总资产
                sideIncome = ownMevEscrow.balanceOf(vault);
                totalAssetsDelta = totalAssetsDelta.add(sideIncome);
            } else {
                sideIncome = result.getSideIncomeDelta();
            }
        }

        BigInteger feeShares = staged.applyRewardDelta(totalAssetsDelta);
        staged.addLiquidity(sideIncome);
        AdvanceResult advance = staged.advanceExitQueue(now);
        BigInteger released = escrow.harvest(vault, sideIncome);
        try {
            journal.record(new JournalEntry.Harvested(params, now));
        } catch (RuntimeException e) {
            // 日志写入失败时退回托管，收割记录与账本副本随异常一起丢弃
            if (released.signum() > 0) {
                escrow.receive(vault, released);
            }
            throw e;
        }

        if (result.isHarvested()) {
            log.info("金库 {} 收益已计入: nonce={}, totalAssetsDelta={}, sideIncome={}, feeShares={}",
                    vault, result.getNonce(), totalAssetsDelta, sideIncome, feeShares);
        }
        if (!advance.isEmpty()) {
            log.info("金库 {} 生成检查点 {}: sharesBurned={}, assetsReleased={}",
                    vault, advance.getCheckpointIndex(), advance.getSharesBurned(), advance.getAssetsReleased());
        } else {
            log.debug("金库 {} 退出队列未推进", vault);
        }
        return new HarvestSettlement(result.isHarvested(), result.getNonce(), totalAssetsDelta, sideIncome,
                feeShares, advance.getSharesBurned(), advance.getAssetsReleased(), advance.getCheckpointIndex());
    }

    @Override
    public ExitTicket enterExitQueue(Address vault, Address owner, BigInteger shares, long now) {
        return mutate(vault, staged -> {
            if (!rewardLedger.isCollateralized(vault)) {
                throw new VaultException(ErrorType.NOT_COLLATERALIZED, "金库 " + vault + " 尚未完成首次收割");
            }
            ExitTicket ticket = staged.enterExitQueue(owner, shares, now);
            journal.record(new JournalEntry.ExitQueueEntered(vault, owner, shares, now));
            log.info("金库 {} 进入退出队列: owner={}, offset={}, shares={}", vault, owner, ticket.getOffset(), shares);
            return ticket;
        });
    }

    @Override
    public SettlementResult settleExitTicket(Address vault, Address caller, BigInteger ticketOffset,
                                             int checkpointIndex, long now) {
        return mutate(vault, staged -> {
            SettlementResult result = staged.settleExitTicket(caller, ticketOffset, checkpointIndex, now);
            journal.record(new JournalEntry.ExitTicketSettled(vault, caller, ticketOffset, checkpointIndex, now));
            log.info("金库 {} 凭证 {} 已结算: exitedShares={}, exitedAssets={}, 剩余={}", vault, ticketOffset,
                    result.getExitedShares(), result.getExitedAssets(), result.getRemainingTicket());
            return result;
        });
    }

    @Override
    public Optional<Integer> getExitQueueIndex(Address vault, BigInteger ticketOffset) {
        return ledger(vault).getExitQueue().findCheckpoint(ticketOffset);
    }

    @Override
    public SettlementResult previewSettlement(Address vault, BigInteger ticketOffset, int checkpointIndex, long now) {
        return ledger(vault).getExitQueue().previewSettle(ticketOffset, checkpointIndex, now);
    }

    @Override
    public ExchangeRate getExchangeRate(Address vault) {
        return ledger(vault).getExchangeRate();
    }

    @Override
    public boolean isCollateralized(Address vault) {
        ledger(vault);
        return rewardLedger.isCollateralized(vault);
    }

    @Override
    public VaultSnapshot getVault(Address vault) {
        return VaultSnapshot.of(ledger(vault), rewardLedger.isCollateralized(vault));
    }

    @Override
    public BigInteger balanceOf(Address vault, Address holder) {
        return ledger(vault).balanceOf(holder);
    }

    @Override
    public Optional<ExitTicket> getExitTicket(Address vault, BigInteger ticketOffset) {
        return ledger(vault).getExitQueue().findTicket(ticketOffset);
    }

    @Override
    public List<Checkpoint> getCheckpoints(Address vault) {
        return ledger(vault).getExitQueue().getCheckpoints();
    }

    private MevEscrow escrowOf(VaultLedger ledger) {
        return ledger.isOwnSideIncomeEscrow() ? ownMevEscrow : sharedMevEscrow;
    }

    /**
     * 在金库锁内对账本副本执行变更，成功后整体替换；任何异常都不留下部分状态
     */
    private <T> T mutate(Address vault, Function<VaultLedger, T> operation) {
        VaultSlot slot = slot(vault);
        slot.lock.lock();
        try {
            VaultLedger staged = slot.ledger.copy();
            T result = operation.apply(staged);
            slot.ledger = staged;
            return result;
        } finally {
            slot.lock.unlock();
        }
    }

    // 已发布的账本不再修改，读操作无需加锁
    private VaultLedger ledger(Address vault) {
        return slot(vault).ledger;
    }

    private VaultSlot slot(Address vault) {
        VaultSlot slot = vault == null ? null : vaults.get(vault);
        if (slot == null) {
            throw new VaultException(ErrorType.VAULT_NOT_FOUND, "金库不存在: " + vault);
        }
        return slot;
    }

    private static final class VaultSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile VaultLedger ledger;

        private VaultSlot(VaultLedger ledger) {
            this.ledger = ledger;
        }
    }
}
