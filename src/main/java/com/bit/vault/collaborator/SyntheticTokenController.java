package com.bit.vault.collaborator;

import java.math.BigInteger;

/**
 * 合成代币控制器：按预言机报告的平均收益率累计债务曲线
 */
public interface SyntheticTokenController {

    void updateAvgRewardPerSecond(BigInteger avgRewardPerSecond, long updateTimestamp);

    BigInteger getAvgRewardPerSecond();

    long getLastUpdateTimestamp();
}
