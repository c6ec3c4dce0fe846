package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class DepositRequest {
    private String vault;
    private String receiver;
    private BigInteger assets;
}
