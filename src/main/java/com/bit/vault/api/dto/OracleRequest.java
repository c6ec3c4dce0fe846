package com.bit.vault.api.dto;

import lombok.Data;

@Data
public class OracleRequest {
    private String oracle;
    // 管理员对 adminDigest 的65字节签名，hex
    private String signature;
}
