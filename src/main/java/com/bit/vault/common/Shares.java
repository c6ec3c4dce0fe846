package com.bit.vault.common;

import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;

/**
 * 带标签的份额数量：FREE 为持有人可自由支配的份额，QUEUED 为已进入退出队列、尚未销毁的份额
 * 两者都计入总份额，不同标签之间不能直接相加减
 */
@Getter
@EqualsAndHashCode
public final class Shares {

    public enum Kind {
        FREE,
        QUEUED
    }

    private final Kind kind;
    private final BigInteger amount;

    private Shares(Kind kind, BigInteger amount) {
        this.kind = kind;
        this.amount = VaultMath.checkUint256(amount, kind + " shares");
    }

    public static Shares free(BigInteger amount) {
        return new Shares(Kind.FREE, amount);
    }

    public static Shares queued(BigInteger amount) {
        return new Shares(Kind.QUEUED, amount);
    }

    public static Shares zero(Kind kind) {
        return new Shares(kind, BigInteger.ZERO);
    }

    public Shares plus(BigInteger delta) {
        return new Shares(kind, amount.add(delta));
    }

    public Shares minus(BigInteger delta) {
        if (amount.compareTo(delta) < 0) {
            throw new VaultException(ErrorType.ARITHMETIC_UNDERFLOW, kind + " shares: " + amount + " - " + delta);
        }
        return new Shares(kind, amount.subtract(delta));
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    /**
     * 总份额 = 自由份额 + 排队份额
     */
    public static BigInteger totalSupply(Shares free, Shares queued) {
        if (free.kind != Kind.FREE || queued.kind != Kind.QUEUED) {
            throw new IllegalArgumentException("totalSupply(" + free.kind + ", " + queued.kind + ")");
        }
        return free.amount.add(queued.amount);
    }

    @Override
    public String toString() {
        return kind + "(" + amount + ")";
    }
}
