package com.bit.vault.keeper;

import com.bit.vault.common.RewardsRootHash;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RewardsUpdateParams {
    private RewardsRootHash rewardsRoot;
    // 收益表在 IPFS 上的引用，签名时取其 keccak256
    private String rewardsIpfsHash;
    private BigInteger avgRewardPerSecond;
    private long updateTimestamp;
    // 打包的65字节签名记录
    private byte[] signatures;
}
