package com.bit.vault.vault;

import com.bit.vault.common.Address;
import com.bit.vault.common.ExchangeRate;
import com.bit.vault.common.Shares;
import com.bit.vault.common.VaultMath;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.exitqueue.AdvanceResult;
import com.bit.vault.exitqueue.ExitQueue;
import com.bit.vault.exitqueue.ExitTicket;
import com.bit.vault.exitqueue.SettlementResult;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 单个金库的份额/资产账本及其退出队列
 * <p>
 * totalAssets 是记账值，liquidBalance 是金库实际持有、可用于兑付的资产；
 * 两者的差额部署在验证者上。非线程安全，变更前先 {@link #copy()}，成功后整体替换。
 */
@Getter
public class VaultLedger {

    private final Address vault;
    private final Address feeRecipient;
    private final int feePercent;
    private final boolean ownSideIncomeEscrow;

    private final Map<Address, BigInteger> balances;
    private Shares freeShares;
    private BigInteger totalAssets;
    private BigInteger liquidBalance;
    private final ExitQueue exitQueue;

    private VaultLedger(Address vault, Address feeRecipient, int feePercent, boolean ownSideIncomeEscrow,
                        Map<Address, BigInteger> balances, Shares freeShares, BigInteger totalAssets,
                        BigInteger liquidBalance, ExitQueue exitQueue) {
        this.vault = vault;
        this.feeRecipient = feeRecipient;
        this.feePercent = feePercent;
        this.ownSideIncomeEscrow = ownSideIncomeEscrow;
        this.balances = balances;
        this.freeShares = freeShares;
        this.totalAssets = totalAssets;
        this.liquidBalance = liquidBalance;
        this.exitQueue = exitQueue;
    }

    /**
     * 新建金库，安全保证金按 1:1 铸造给金库自身
     */
    public static VaultLedger create(Address vault, Address feeRecipient, int feePercent, boolean ownSideIncomeEscrow,
                                     BigInteger securityDeposit, long claimDelay, long queueUpdateDelay) {
        if (feePercent < 0 || feePercent > VaultMath.MAX_FEE_PERCENT) {
            throw new VaultException(ErrorType.INVALID_FEE, "feePercent = " + feePercent);
        }
        if (securityDeposit == null || securityDeposit.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_ASSETS, "安全保证金必须大于0");
        }
        Map<Address, BigInteger> balances = new HashMap<>();
        balances.put(vault, securityDeposit);
        return new VaultLedger(vault, feeRecipient, feePercent, ownSideIncomeEscrow, balances,
                Shares.free(securityDeposit), securityDeposit, securityDeposit,
                new ExitQueue(claimDelay, queueUpdateDelay));
    }

    public VaultLedger copy() {
        return new VaultLedger(vault, feeRecipient, feePercent, ownSideIncomeEscrow, new HashMap<>(balances),
                freeShares, totalAssets, liquidBalance, exitQueue.copy());
    }

    public BigInteger getTotalShares() {
        return Shares.totalSupply(freeShares, exitQueue.getQueuedShares());
    }

    public ExchangeRate getExchangeRate() {
        return new ExchangeRate(totalAssets, getTotalShares());
    }

    public BigInteger balanceOf(Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public Map<Address, BigInteger> getBalances() {
        return Collections.unmodifiableMap(balances);
    }

    /**
     * 未被待领取资产占用的流动资产
     */
    public BigInteger getAvailableAssets() {
        BigInteger available = liquidBalance.subtract(exitQueue.getUnclaimedAssets());
        return available.signum() > 0 ? available : BigInteger.ZERO;
    }

    /**
     * 存入资产，按当前汇率向下取整铸造份额
     */
    public BigInteger deposit(Address receiver, BigInteger assets) {
        if (assets == null || assets.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_ASSETS, "存入资产必须大于0");
        }
        BigInteger shares = getExchangeRate().convertToShares(assets);
        if (shares.signum() == 0) {
            throw new VaultException(ErrorType.INVALID_SHARES, "存入资产 " + assets + " 不足一份");
        }
        totalAssets = VaultMath.checkUint256(totalAssets.add(assets), "totalAssets");
        liquidBalance = VaultMath.checkUint256(liquidBalance.add(assets), "liquidBalance");
        mint(receiver, shares);
        return shares;
    }

    /**
     * 计入收益增量；为正时先更新总资产，再按更新后的汇率给手续费接收人铸造份额
     *
     * @return 铸造的手续费份额
     */
    public BigInteger applyRewardDelta(BigInteger delta) {
        if (delta.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger totalSharesBefore = getTotalShares();
        BigInteger newTotalAssets = totalAssets.add(delta);
        if (newTotalAssets.signum() < 0) {
            throw new VaultException(ErrorType.ARITHMETIC_UNDERFLOW,
                    "罚没 " + delta.negate() + " 超过总资产 " + totalAssets);
        }
        totalAssets = VaultMath.checkUint256(newTotalAssets, "totalAssets");
        if (delta.signum() < 0 || feePercent == 0) {
            return BigInteger.ZERO;
        }
        BigInteger feeAssets = VaultMath.mulDivDown(delta, BigInteger.valueOf(feePercent),
                BigInteger.valueOf(VaultMath.MAX_FEE_PERCENT));
        if (feeAssets.signum() == 0 || totalSharesBefore.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger feeShares = VaultMath.mulDivDown(feeAssets, totalSharesBefore, totalAssets);
        if (feeShares.signum() > 0) {
            mint(feeRecipient, feeShares);
        }
        return feeShares;
    }

    /**
     * 增加流动资产（旁路收入、退回的本金）；不改变总资产
     */
    public void addLiquidity(BigInteger assets) {
        liquidBalance = VaultMath.checkUint256(liquidBalance.add(assets), "liquidBalance");
    }

    /**
     * 本金在金库与验证者之间移动：为负表示部署到验证者，为正表示退回
     */
    public void movePrincipal(BigInteger delta) {
        if (delta.signum() < 0 && getAvailableAssets().compareTo(delta.negate()) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                    "可用流动资产 " + getAvailableAssets() + " 不足以部署 " + delta.negate());
        }
        liquidBalance = VaultMath.checkUint256(liquidBalance.add(delta), "liquidBalance");
    }

    /**
     * 用可用流动资产推进退出队列，并同步从总资产中扣除释放的资产
     */
    public AdvanceResult advanceExitQueue(long now) {
        AdvanceResult result = exitQueue.advance(getAvailableAssets(), getExchangeRate(), now);
        if (!result.isEmpty()) {
            totalAssets = VaultMath.sub(totalAssets, result.getAssetsReleased(), "totalAssets");
        }
        return result;
    }

    public ExitTicket enterExitQueue(Address owner, BigInteger shares, long now) {
        if (shares == null || shares.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_SHARES, "退出份额必须大于0");
        }
        burnFree(owner, shares);
        return exitQueue.enter(owner, shares, now);
    }

    public SettlementResult settleExitTicket(Address caller, BigInteger ticketOffset, int checkpointIndex, long now) {
        SettlementResult result = exitQueue.settle(caller, ticketOffset, checkpointIndex, now);
        liquidBalance = VaultMath.sub(liquidBalance, result.getExitedAssets(), "liquidBalance");
        return result;
    }

    /**
     * 未抵押金库的即时赎回，从可用流动资产中兑付
     */
    public BigInteger redeem(Address owner, BigInteger shares) {
        if (shares == null || shares.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_SHARES, "赎回份额必须大于0");
        }
        if (balanceOf(owner).compareTo(shares) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_SHARES, "持有份额不足");
        }
        BigInteger assets = getExchangeRate().convertToAssets(shares);
        if (assets.signum() == 0) {
            throw new VaultException(ErrorType.INVALID_ASSETS, "赎回资产为0");
        }
        if (getAvailableAssets().compareTo(assets) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                    "可用流动资产 " + getAvailableAssets() + " 不足以兑付 " + assets);
        }
        burnFree(owner, shares);
        totalAssets = VaultMath.sub(totalAssets, assets, "totalAssets");
        liquidBalance = VaultMath.sub(liquidBalance, assets, "liquidBalance");
        return assets;
    }

    private void mint(Address holder, BigInteger shares) {
        freeShares = freeShares.plus(shares);
        VaultMath.checkUint256(getTotalShares(), "totalShares");
        balances.merge(holder, shares, BigInteger::add);
    }

    private void burnFree(Address holder, BigInteger shares) {
        BigInteger balance = balanceOf(holder);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_SHARES,
                    "持有份额 " + balance + " 少于 " + shares);
        }
        BigInteger left = balance.subtract(shares);
        if (left.signum() == 0) {
            balances.remove(holder);
        } else {
            balances.put(holder, left);
        }
        freeShares = freeShares.minus(shares);
    }
}
