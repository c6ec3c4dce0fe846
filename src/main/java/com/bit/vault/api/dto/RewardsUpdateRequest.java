package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

/**
 * 收益根更新请求，signatures 为按签名者地址升序拼接的65字节签名（十六进制）
 */
@Data
public class RewardsUpdateRequest {
    private String rewardsRoot;
    private String rewardsIpfsHash;
    private BigInteger avgRewardPerSecond;
    private long updateTimestamp;
    private String signatures;
}
