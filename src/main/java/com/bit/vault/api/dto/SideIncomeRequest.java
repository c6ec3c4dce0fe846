package com.bit.vault.api.dto;

import lombok.Data;

import java.math.BigInteger;

@Data
public class SideIncomeRequest {
    private String vault;
    private BigInteger amount;
}
