package com.bit.vault.keeper.impl;

import com.bit.vault.collaborator.SyntheticTokenController;
import com.bit.vault.common.Address;
import com.bit.vault.common.VaultMath;
import com.bit.vault.config.VaultProperties;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.journal.JournalEntry;
import com.bit.vault.journal.VaultJournal;
import com.bit.vault.keeper.HarvestCallback;
import com.bit.vault.keeper.HarvestParams;
import com.bit.vault.keeper.HarvestResult;
import com.bit.vault.keeper.MerkleProofs;
import com.bit.vault.keeper.RewardConsensusLedger;
import com.bit.vault.keeper.RewardLeaf;
import com.bit.vault.keeper.RewardRecord;
import com.bit.vault.keeper.RewardsAttestation;
import com.bit.vault.keeper.RewardsRoot;
import com.bit.vault.keeper.RewardsUpdateParams;
import com.bit.vault.oracle.AttestationVerifier;
import com.bit.vault.oracle.OracleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Component
public class RewardConsensusLedgerImpl implements RewardConsensusLedger {

    @Autowired
    private VaultProperties properties;

    @Autowired
    private OracleRegistry oracleRegistry;

    @Autowired
    private AttestationVerifier attestationVerifier;

    @Autowired
    private SyntheticTokenController syntheticTokenController;

    @Autowired
    private VaultJournal journal;

    // updateRewards 持写锁，harvest 持读锁
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile RewardsRoot rewardsRoot = RewardsRoot.initial();

    private final Map<Address, VaultRegistration> vaults = new ConcurrentHashMap<>();

    @Override
    public void registerVault(Address vault, boolean ownSideIncomeEscrow) {
        VaultRegistration prev = vaults.putIfAbsent(vault, new VaultRegistration(ownSideIncomeEscrow));
        if (prev != null) {
            throw new VaultException(ErrorType.VAULT_EXISTS, "金库已登记: " + vault);
        }
    }

    @Override
    public RewardsRoot updateRewards(RewardsUpdateParams params) {
        lock.writeLock().lock();
        try {
            RewardsRoot current = rewardsRoot;
            long updateDelay = properties.getKeeper().getUpdateDelay();
            if (params.getUpdateTimestamp() < current.getLastUpdateTimestamp() + updateDelay) {
                throw new VaultException(ErrorType.TOO_EARLY, "距上次更新不足 " + updateDelay + " 秒");
            }
            BigInteger avgRate = params.getAvgRewardPerSecond();
            if (avgRate == null || avgRate.signum() < 0
                    || avgRate.compareTo(properties.getKeeper().getMaxAvgRewardPerSecond()) > 0) {
                throw new VaultException(ErrorType.INVALID_RATE, "avgRewardPerSecond = " + avgRate);
            }
            if (params.getRewardsRoot() == null || params.getRewardsRoot().isZero()) {
                throw new VaultException(ErrorType.INVALID_ROOT, "收益根不能为零");
            }

            byte[] message = RewardsAttestation.digest(
                    properties.getKeeper().getChainId(),
                    params.getRewardsRoot(),
                    params.getRewardsIpfsHash(),
                    avgRate,
                    params.getUpdateTimestamp(),
                    current.getNonce());
            attestationVerifier.verify(message, params.getSignatures(),
                    oracleRegistry.getMinOracles(), oracleRegistry.getOracles());

            RewardsRoot updated = current.advance(params.getRewardsRoot(), params.getUpdateTimestamp(), avgRate);
            journal.record(new JournalEntry.RewardsUpdated(params));
            rewardsRoot = updated;
            syntheticTokenController.updateAvgRewardPerSecond(avgRate, params.getUpdateTimestamp());
            log.info("收益根已更新: root={}, nonce={}, avgRewardPerSecond={}, ipfs={}",
                    updated.getRoot(), updated.getNonce(), avgRate, params.getRewardsIpfsHash());
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public HarvestResult harvest(Address caller, HarvestParams params) {
        return harvest(caller, params, result -> result);
    }

    @Override
    public <T> T harvest(Address caller, HarvestParams params, HarvestCallback<T> callback) {
        Address vault = params.getVault();
        VaultRegistration registration = vault == null ? null : vaults.get(vault);
        if (registration == null || !vault.equals(caller)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "只有金库本身可以收割: caller=" + caller);
        }
        VaultMath.checkInt192(params.getReward(), "reward");
        VaultMath.checkUint192(params.getUnlockedSideIncome(), "unlockedSideIncome");

        lock.readLock().lock();
        try {
            synchronized (registration) {
                RewardsRoot current = rewardsRoot;
                long nonce = current.nonceOf(params.getRewardsRoot());
                if (nonce < 0) {
                    throw new VaultException(ErrorType.INVALID_ROOT, "收益根不是最近两代之一: " + params.getRewardsRoot());
                }
                byte[] leaf = RewardLeaf.hash(vault, params.getReward(), params.getUnlockedSideIncome());
                if (!MerkleProofs.verify(params.getProof(), params.getRewardsRoot().getBytes(), leaf)) {
                    throw new VaultException(ErrorType.INVALID_PROOF, "金库 " + vault + " 的收益证明无效");
                }

                RewardRecord rewardRecord = registration.rewards;
                if (nonce <= rewardRecord.getNonce()) {
                    log.debug("金库 {} 已计入 nonce {}，忽略 nonce {} 的收割", vault, rewardRecord.getNonce(), nonce);
                    return callback.apply(HarvestResult.noop(rewardRecord.getNonce()));
                }

                BigInteger rewardDelta = params.getReward().subtract(rewardRecord.getValue());
                RewardRecord newRewards = new RewardRecord(params.getReward(), nonce);

                BigInteger sideIncomeDelta = BigInteger.ZERO;
                RewardRecord newSideIncome = registration.sideIncome;
                if (!registration.ownSideIncomeEscrow && nonce > registration.sideIncome.getNonce()) {
                    sideIncomeDelta = VaultMath.sub(params.getUnlockedSideIncome(),
                            registration.sideIncome.getValue(), "sideIncomeDelta");
                    newSideIncome = new RewardRecord(params.getUnlockedSideIncome(), nonce);
                }

                HarvestResult result = new HarvestResult(rewardDelta, sideIncomeDelta, nonce, true);
                T applied = callback.apply(result);
                registration.rewards = newRewards;
                registration.sideIncome = newSideIncome;
                log.info("金库 {} 已收割: root={}, nonce={}, rewardDelta={}, sideIncomeDelta={}",
                        vault, params.getRewardsRoot(), nonce, rewardDelta, sideIncomeDelta);
                return applied;
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void deregisterVault(Address vault) {
        VaultRegistration registration = vaults.get(vault);
        if (registration == null) {
            return;
        }
        synchronized (registration) {
            if (registration.rewards.getNonce() != 0) {
                throw new IllegalStateException("金库 " + vault + " 已收割，不能撤销登记");
            }
            vaults.remove(vault, registration);
        }
        log.info("金库 {} 登记已撤销", vault);
    }

    @Override
    public RewardsRoot getRewardsRoot() {
        return rewardsRoot;
    }

    @Override
    public RewardRecord getRewardRecord(Address vault) {
        VaultRegistration registration = vaults.get(vault);
        return registration == null ? RewardRecord.EMPTY : registration.rewards;
    }

    @Override
    public RewardRecord getSideIncomeRecord(Address vault) {
        VaultRegistration registration = vaults.get(vault);
        return registration == null ? RewardRecord.EMPTY : registration.sideIncome;
    }

    @Override
    public boolean canUpdateRewards(long now) {
        return now >= rewardsRoot.getLastUpdateTimestamp() + properties.getKeeper().getUpdateDelay();
    }

    @Override
    public boolean canHarvest(Address vault) {
        return getRewardRecord(vault).getNonce() < rewardsRoot.getNonce();
    }

    @Override
    public boolean isHarvestRequired(Address vault) {
        long nonce = getRewardRecord(vault).getNonce();
        return nonce != 0 && nonce + 1 < rewardsRoot.getNonce();
    }

    @Override
    public boolean isCollateralized(Address vault) {
        return getRewardRecord(vault).getNonce() != 0;
    }

    /**
     * 单个金库的收割记录，以对象本身作为该金库收割的互斥锁
     */
    private static final class VaultRegistration {
        private final boolean ownSideIncomeEscrow;
        private volatile RewardRecord rewards = RewardRecord.EMPTY;
        private volatile RewardRecord sideIncome = RewardRecord.EMPTY;

        private VaultRegistration(boolean ownSideIncomeEscrow) {
            this.ownSideIncomeEscrow = ownSideIncomeEscrow;
        }
    }
}
