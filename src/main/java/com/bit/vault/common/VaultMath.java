package com.bit.vault.common;

import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;

import java.math.BigInteger;

/**
 * 定点整数运算：所有金额都是无符号/有符号定宽整数，越界即致命错误
 */
public final class VaultMath {

    public static final BigInteger MAX_UINT128 = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT192 = BigInteger.ONE.shiftLeft(192).subtract(BigInteger.ONE);
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    public static final BigInteger MAX_INT192 = BigInteger.ONE.shiftLeft(191).subtract(BigInteger.ONE);
    public static final BigInteger MIN_INT192 = BigInteger.ONE.shiftLeft(191).negate();

    // 手续费基点上限
    public static final int MAX_FEE_PERCENT = 10_000;

    private VaultMath() {
    }

    public static BigInteger checkUint128(BigInteger value, String what) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT128, what);
    }

    public static BigInteger checkUint192(BigInteger value, String what) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT192, what);
    }

    public static BigInteger checkUint256(BigInteger value, String what) {
        return checkRange(value, BigInteger.ZERO, MAX_UINT256, what);
    }

    public static BigInteger checkInt192(BigInteger value, String what) {
        return checkRange(value, MIN_INT192, MAX_INT192, what);
    }

    private static BigInteger checkRange(BigInteger value, BigInteger min, BigInteger max, String what) {
        if (value == null) {
            throw new IllegalArgumentException(what + " cannot be null");
        }
        if (value.compareTo(min) < 0) {
            throw new VaultException(ErrorType.ARITHMETIC_UNDERFLOW, what + " = " + value);
        }
        if (value.compareTo(max) > 0) {
            throw new VaultException(ErrorType.ARITHMETIC_OVERFLOW, what + " = " + value);
        }
        return value;
    }

    /**
     * 无符号减法，结果为负即下溢
     */
    public static BigInteger sub(BigInteger a, BigInteger b, String what) {
        BigInteger r = a.subtract(b);
        if (r.signum() < 0) {
            throw new VaultException(ErrorType.ARITHMETIC_UNDERFLOW, what + ": " + a + " - " + b);
        }
        return r;
    }

    /**
     * floor(a * b / c)
     */
    public static BigInteger mulDivDown(BigInteger a, BigInteger b, BigInteger c) {
        if (c.signum() == 0) {
            throw new VaultException(ErrorType.DIVISION_BY_ZERO, "mulDiv denominator is zero");
        }
        return a.multiply(b).divide(c);
    }
}
