package com.bit.vault.keeper;

import com.bit.vault.common.Address;

/**
 * 收益共识账本：持有全局两代收益根，按金库记录已计入的累计收益与 nonce
 * 一个实例服务所有金库
 */
public interface RewardConsensusLedger {

    /**
     * 登记可收割的金库
     * @param ownSideIncomeEscrow 金库自持旁路收入托管时忽略预言机报告的旁路收入
     */
    void registerVault(Address vault, boolean ownSideIncomeEscrow);

    /**
     * 在法定人数签名下安装新收益根
     * @return 更新后的收益根
     */
    RewardsRoot updateRewards(RewardsUpdateParams params);

    HarvestResult harvest(Address caller, HarvestParams params);

    /**
     * 收割并在记录落库前执行回调；回调与落库在同一读锁内，期间收益根不会变化
     * @return 回调的返回值
     */
    <T> T harvest(Address caller, HarvestParams params, HarvestCallback<T> callback);

    /**
     * 撤销尚未收割过的登记，仅用于回滚失败的金库创建
     */
    void deregisterVault(Address vault);

    RewardsRoot getRewardsRoot();

    RewardRecord getRewardRecord(Address vault);

    RewardRecord getSideIncomeRecord(Address vault);

    boolean canUpdateRewards(long now);

    /**
     * 当前根尚未计入该金库
     */
    boolean canHarvest(Address vault);

    /**
     * 已抵押且落后超过一代收益根
     */
    boolean isHarvestRequired(Address vault);

    /**
     * 至少成功收割过一次
     */
    boolean isCollateralized(Address vault);
}
