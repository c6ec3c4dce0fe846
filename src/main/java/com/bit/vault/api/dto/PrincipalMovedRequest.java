package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class PrincipalMovedRequest {
    private String vault;
    private BigInteger amountDelta;//负数表示部署到验证者
}
