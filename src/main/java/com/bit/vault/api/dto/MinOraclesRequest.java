package com.bit.vault.api.dto;

import lombok.Data;

@Data
public class MinOraclesRequest {
    private int minOracles;
    private String signature;
}
