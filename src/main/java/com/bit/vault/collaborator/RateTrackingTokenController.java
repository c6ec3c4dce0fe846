package com.bit.vault.collaborator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 只记录最近一次收益率的默认实现
 */
@Slf4j
@Component
public class RateTrackingTokenController implements SyntheticTokenController {

    private volatile BigInteger avgRewardPerSecond = BigInteger.ZERO;
    private volatile long lastUpdateTimestamp;

    @Override
    public synchronized void updateAvgRewardPerSecond(BigInteger avgRewardPerSecond, long updateTimestamp) {
        this.avgRewardPerSecond = avgRewardPerSecond;
        this.lastUpdateTimestamp = updateTimestamp;
        log.debug("合成代币收益率更新为 {}/s", avgRewardPerSecond);
    }

    @Override
    public BigInteger getAvgRewardPerSecond() {
        return avgRewardPerSecond;
    }

    @Override
    public long getLastUpdateTimestamp() {
        return lastUpdateTimestamp;
    }
}
