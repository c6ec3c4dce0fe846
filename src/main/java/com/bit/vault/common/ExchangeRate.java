package com.bit.vault.common;

import lombok.Data;

import java.math.BigInteger;

/**
 * 汇率 totalAssets / totalShares；所有换算向下取整，舍入方向有利于金库
 */
@Data
public class ExchangeRate {
    private final BigInteger totalAssets;
    private final BigInteger totalShares;

    public BigInteger convertToShares(BigInteger assets) {
        if (totalShares.signum() == 0) {
            return assets;
        }
        return VaultMath.mulDivDown(assets, totalShares, totalAssets);
    }

    public BigInteger convertToAssets(BigInteger shares) {
        if (totalShares.signum() == 0) {
            return shares;
        }
        return VaultMath.mulDivDown(shares, totalAssets, totalShares);
    }
}
