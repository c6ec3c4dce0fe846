package com.bit.vault.vault;

import com.bit.vault.collaborator.ValidatorRegistryCallback;
import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.exitqueue.Checkpoint;
import com.bit.vault.exitqueue.ExitTicket;
import com.bit.vault.exitqueue.SettlementResult;
import com.bit.vault.keeper.HarvestParams;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * 金库账本服务，每个金库一把锁，所有变更全有或全无
 */
public interface VaultService extends ValidatorRegistryCallback {

    /**
     * 创建金库并铸造安全保证金
     */
    VaultSnapshot createVault(Address vault, Address feeRecipient, int feePercent, boolean ownSideIncomeEscrow);

    /**
     * 指定安全保证金创建金库，重放日志时使用记录中的值
     */
    VaultSnapshot createVault(Address vault, Address feeRecipient, int feePercent, boolean ownSideIncomeEscrow,
                              BigInteger securityDeposit);

    /**
     * @return 铸造的份额
     */
    BigInteger deposit(Address vault, Address receiver, BigInteger assets);

    /**
     * 未抵押金库的即时赎回
     * @return 兑付的资产
     */
    BigInteger redeem(Address vault, Address owner, BigInteger shares);

    void receiveSideIncome(Address vault, BigInteger amount);

    /**
     * 收割收益后用可用流动资产推进退出队列，整体原子
     */
    HarvestSettlement harvestAndSettle(HarvestParams params, long now);

    ExitTicket enterExitQueue(Address vault, Address owner, BigInteger shares, long now);

    SettlementResult settleExitTicket(Address vault, Address caller, BigInteger ticketOffset, int checkpointIndex, long now);

    /**
     * 覆盖该凭证起点的检查点下标，尚未被任何检查点覆盖时为空
     */
    Optional<Integer> getExitQueueIndex(Address vault, BigInteger ticketOffset);

    SettlementResult previewSettlement(Address vault, BigInteger ticketOffset, int checkpointIndex, long now);

    ExchangeRate getExchangeRate(Address vault);

    boolean isCollateralized(Address vault);

    VaultSnapshot getVault(Address vault);

    BigInteger balanceOf(Address vault, Address holder);

    Optional<ExitTicket> getExitTicket(Address vault, BigInteger ticketOffset);

    List<Checkpoint> getCheckpoints(Address vault);
}
