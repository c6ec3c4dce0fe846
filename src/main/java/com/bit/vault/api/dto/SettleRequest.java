package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class SettleRequest {
    private String vault;
    private BigInteger ticketOffset;
    private int checkpointIndex;
    // 凭证持有人对结算摘要的签名，结算调用者由签名恢复
    private String signature;
}
