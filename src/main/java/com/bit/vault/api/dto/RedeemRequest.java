package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class RedeemRequest {
    private String vault;
    private String owner;
    private BigInteger shares;
}
