package com.bit.vault.api.dto;

import lombok.Data;

@Data
public class CreateVaultRequest {
    private String vault;
    private String feeRecipient;
    private int feePercent;//基点
    private boolean ownSideIncomeEscrow;
}
