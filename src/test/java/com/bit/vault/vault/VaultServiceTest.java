package com.bit.vault.vault;

import com.bit.vault.OracleFixture;
import com.bit.vault.collaborator.OwnMevEscrow;
import com.bit.vault.collaborator.SharedMevEscrow;
import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.exitqueue.ExitTicket;
import com.bit.vault.exitqueue.SettlementResult;
import com.bit.vault.journal.VaultJournal;
import com.bit.vault.keeper.HarvestParams;
import com.bit.vault.keeper.RewardConsensusLedger;
import com.bit.vault.keeper.RewardsTree;
import com.bit.vault.oracle.OracleRegistry;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public class VaultServiceTest {

    private static final long UPDATE_DELAY = 43_200;
    private static final long CLAIM_DELAY = 86_400;
    private static final long T0 = 1_700_000_000L;
    private static final BigInteger RATE = BigInteger.valueOf(1_000_000_000L);

    private static final Address VAULT = Address.fromHex("0x1111111111111111111111111111111111111111");
    private static final Address OWN_VAULT = Address.fromHex("0x4444444444444444444444444444444444444444");
    private static final Address TREASURY = Address.fromHex("0x2222222222222222222222222222222222222222");
    private static final Address USER = Address.fromHex("0x3333333333333333333333333333333333333333");

    @Autowired
    private VaultService vaultService;

    @Autowired
    private RewardConsensusLedger rewardLedger;

    @Autowired
    private OracleRegistry oracleRegistry;

    @Autowired
    private SharedMevEscrow sharedMevEscrow;

    @Autowired
    private OwnMevEscrow ownMevEscrow;

    @Autowired
    private VaultJournal journal;

    private final OracleFixture oracles = new OracleFixture(3);
    private long nextUpdate = T0;

    @BeforeEach
    void setUp() {
        for (Address oracle : oracles.addresses()) {
            oracleRegistry.addOracle(OracleFixture.OWNER, oracle);
        }
        oracleRegistry.setMinOracles(OracleFixture.OWNER, 2);
        vaultService.createVault(VAULT, TREASURY, 1_000, false, BigInteger.valueOf(500));
        vaultService.deposit(VAULT, USER, BigInteger.valueOf(500));
    }

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }

    /**
     * 发布只含 VAULT 与 OWN_VAULT 两个叶子的收益根，返回 VAULT 的收割参数
     */
    private HarvestParams publish(long reward, long sideIncome) {
        RewardsTree.VaultReward leaf = new RewardsTree.VaultReward(VAULT, big(reward), big(sideIncome));
        RewardsTree.VaultReward ownLeaf = new RewardsTree.VaultReward(OWN_VAULT, big(reward), big(sideIncome));
        RewardsTree tree = RewardsTree.build(List.of(leaf, ownLeaf));
        long nonce = rewardLedger.getRewardsRoot().getNonce();
        rewardLedger.updateRewards(oracles.update(tree.getRoot(), RATE, nextUpdate, nonce, 3));
        nextUpdate += UPDATE_DELAY;
        lastOwnParams = new HarvestParams(OWN_VAULT, tree.getRoot(), ownLeaf.getReward(),
                ownLeaf.getUnlockedSideIncome(), tree.getProof(ownLeaf));
        return new HarvestParams(VAULT, tree.getRoot(), leaf.getReward(), leaf.getUnlockedSideIncome(), tree.getProof(leaf));
    }

    private HarvestParams lastOwnParams;

    @Test
    void harvestEnterAndSettleExample() {
        HarvestParams params = publish(100, 0);
        HarvestSettlement harvest = vaultService.harvestAndSettle(params, T0);
        assertTrue(harvest.isHarvested());
        assertEquals(big(9), harvest.getFeeShares());
        assertEquals(big(9), vaultService.balanceOf(VAULT, TREASURY));
        VaultSnapshot snapshot = vaultService.getVault(VAULT);
        assertEquals(big(1_009), snapshot.getTotalShares());
        assertEquals(big(1_100), snapshot.getTotalAssets());
        assertTrue(snapshot.isCollateralized());

        vaultService.onPrincipalMoved(VAULT, big(-700));
        ExitTicket ticket = vaultService.enterExitQueue(VAULT, USER, big(500), T0);
        assertEquals(BigInteger.ZERO, ticket.getOffset());

        // 同一收益根再次调用：收益不重复计入，但仍推进退出队列
        HarvestSettlement settle = vaultService.harvestAndSettle(params, T0 + 10);
        assertFalse(settle.isHarvested());
        assertEquals(BigInteger.ZERO, settle.getFeeShares());
        assertEquals(big(275), settle.getSharesBurned());
        assertEquals(big(299), settle.getAssetsReleased());
        assertEquals(0, settle.getCheckpointIndex());

        assertEquals(Optional.of(0), vaultService.getExitQueueIndex(VAULT, BigInteger.ZERO));
        VaultException early = assertThrows(VaultException.class,
                () -> vaultService.settleExitTicket(VAULT, USER, BigInteger.ZERO, 0, T0 + CLAIM_DELAY - 1));
        assertEquals(ErrorType.TOO_EARLY, early.getErrorType());

        SettlementResult preview = vaultService.previewSettlement(VAULT, BigInteger.ZERO, 0, T0 + CLAIM_DELAY);
        SettlementResult result = vaultService.settleExitTicket(VAULT, USER, BigInteger.ZERO, 0, T0 + CLAIM_DELAY);
        assertEquals(preview, result);
        assertEquals(big(275), result.getExitedShares());
        assertEquals(big(299), result.getExitedAssets());
        assertEquals(new ExitTicket(big(275), big(225), T0, USER), result.getRemainingTicket());
        assertEquals(result.getRemainingTicket(), vaultService.getExitTicket(VAULT, big(275)).orElseThrow());

        snapshot = vaultService.getVault(VAULT);
        assertEquals(big(734), snapshot.getTotalShares());
        assertEquals(big(801), snapshot.getTotalAssets());
        assertEquals(BigInteger.ONE, snapshot.getLiquidBalance());
        assertEquals(BigInteger.ZERO, snapshot.getUnclaimedAssets());
    }

    @Test
    void exitQueueRequiresCollateral() {
        VaultException e = assertThrows(VaultException.class,
                () -> vaultService.enterExitQueue(VAULT, USER, big(100), T0));
        assertEquals(ErrorType.NOT_COLLATERALIZED, e.getErrorType());
        assertFalse(vaultService.isCollateralized(VAULT));

        // 抵押前可即时赎回
        assertEquals(big(100), vaultService.redeem(VAULT, USER, big(100)));

        vaultService.harvestAndSettle(publish(0, 0), T0);
        assertTrue(vaultService.isCollateralized(VAULT));
        VaultException redeem = assertThrows(VaultException.class, () -> vaultService.redeem(VAULT, USER, big(100)));
        assertEquals(ErrorType.COLLATERALIZED, redeem.getErrorType());
        assertEquals(big(400), vaultService.balanceOf(VAULT, USER));
    }

    @Test
    void depositBlockedWhileHarvestRequired() {
        vaultService.harvestAndSettle(publish(100, 0), T0);
        publish(120, 0);
        HarvestParams latest = publish(150, 0);

        VaultException e = assertThrows(VaultException.class, () -> vaultService.deposit(VAULT, USER, big(10)));
        assertEquals(ErrorType.NOT_HARVESTED, e.getErrorType());

        HarvestSettlement catchUp = vaultService.harvestAndSettle(latest, T0);
        assertEquals(big(50), catchUp.getTotalAssetsDelta());
        assertTrue(vaultService.deposit(VAULT, USER, big(10)).signum() > 0);
    }

    @Test
    void sharedSideIncomeMovesLiquidityOnly() {
        vaultService.receiveSideIncome(VAULT, big(80));
        assertEquals(big(80), sharedMevEscrow.balanceOf(VAULT));

        HarvestSettlement harvest = vaultService.harvestAndSettle(publish(100, 30), T0);
        assertEquals(big(30), harvest.getSideIncome());
        assertEquals(big(100), harvest.getTotalAssetsDelta());
        VaultSnapshot snapshot = vaultService.getVault(VAULT);
        assertEquals(big(1_030), snapshot.getLiquidBalance());
        assertEquals(big(1_100), snapshot.getTotalAssets());
        assertEquals(big(50), sharedMevEscrow.balanceOf(VAULT));
    }

    @Test
    void insufficientSharedEscrowRollsBackHarvest() {
        vaultService.receiveSideIncome(VAULT, big(10));
        HarvestParams params = publish(100, 30);
        long journalSize = journal.size();

        VaultException e = assertThrows(VaultException.class, () -> vaultService.harvestAndSettle(params, T0));
        assertEquals(ErrorType.INSUFFICIENT_ASSETS, e.getErrorType());
        assertTrue(rewardLedger.canHarvest(VAULT));
        assertEquals(big(1_000), vaultService.getVault(VAULT).getTotalAssets());
        assertEquals(big(10), sharedMevEscrow.balanceOf(VAULT));
        assertEquals(journalSize, journal.size());
    }

    @Test
    void ownEscrowIncomeCountsAsReward() {
        vaultService.createVault(OWN_VAULT, TREASURY, 0, true, big(1_000));
        vaultService.receiveSideIncome(OWN_VAULT, big(40));
        assertEquals(big(40), ownMevEscrow.balanceOf(OWN_VAULT));

        publish(100, 30);
        HarvestSettlement harvest = vaultService.harvestAndSettle(lastOwnParams, T0);
        assertEquals(big(140), harvest.getTotalAssetsDelta());
        assertEquals(big(40), harvest.getSideIncome());
        VaultSnapshot snapshot = vaultService.getVault(OWN_VAULT);
        assertEquals(big(1_140), snapshot.getTotalAssets());
        assertEquals(big(1_040), snapshot.getLiquidBalance());
        assertEquals(BigInteger.ZERO, ownMevEscrow.balanceOf(OWN_VAULT));
    }

    @Test
    void fatalPenaltyAbortsWholeHarvest() {
        vaultService.harvestAndSettle(publish(100, 0), T0);
        HarvestParams slash = publish(-2_000, 0);
        VaultException e = assertThrows(VaultException.class, () -> vaultService.harvestAndSettle(slash, T0));
        assertEquals(ErrorType.ARITHMETIC_UNDERFLOW, e.getErrorType());
        assertEquals(1, rewardLedger.getRewardRecord(VAULT).getNonce());
        assertEquals(big(1_100), vaultService.getVault(VAULT).getTotalAssets());
    }

    @Test
    void principalMoveRequiresAmount() {
        VaultException e = assertThrows(VaultException.class, () -> vaultService.onPrincipalMoved(VAULT, null));
        assertEquals(ErrorType.INVALID_ASSETS, e.getErrorType());
        assertEquals(big(1_000), vaultService.getVault(VAULT).getLiquidBalance());
    }

    @Test
    void unknownVaultAndDuplicateCreation() {
        Address missing = Address.fromHex("0x9999999999999999999999999999999999999999");
        assertEquals(ErrorType.VAULT_NOT_FOUND,
                assertThrows(VaultException.class, () -> vaultService.getVault(missing)).getErrorType());
        assertEquals(ErrorType.VAULT_EXISTS,
                assertThrows(VaultException.class, () -> vaultService.createVault(VAULT, TREASURY, 0, false)).getErrorType());
        assertEquals(ErrorType.INVALID_FEE,
                assertThrows(VaultException.class, () -> vaultService.createVault(missing, TREASURY, 20_000, false)).getErrorType());
        assertEquals(ErrorType.VAULT_NOT_FOUND,
                assertThrows(VaultException.class, () -> vaultService.getVault(missing)).getErrorType());
    }
}
