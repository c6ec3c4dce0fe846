package com.bit.vault.exception;

import lombok.Getter;

/**
 * 错误码（编号与名称对外稳定，UI 依赖它们区分"稍后再试"和"输入错误"）
 */
@Getter
public enum ErrorType {
    TOO_EARLY(1001, ErrorCategory.REJECTED, "时间未到（更新间隔或领取延迟未满足）"),
    INVALID_RATE(1002, ErrorCategory.REJECTED, "平均收益率超出上限"),
    INVALID_ROOT(1003, ErrorCategory.REJECTED, "收益根不是最近两代之一"),
    INVALID_PROOF(1004, ErrorCategory.REJECTED, "默克尔证明校验失败"),
    INVALID_CHECKPOINT(1005, ErrorCategory.REJECTED, "检查点索引未覆盖该退出票据"),
    ACCESS_DENIED(1006, ErrorCategory.REJECTED, "无权限"),
    NOT_ENOUGH_SIGNATURES(1007, ErrorCategory.REJECTED, "签名数量不足"),
    INVALID_SIGNATURE(1008, ErrorCategory.REJECTED, "签名无效（未知签名者/重复/未升序）"),
    INVALID_ORACLES(1009, ErrorCategory.REJECTED, "预言机集合配置无效"),
    INVALID_SHARES(1010, ErrorCategory.REJECTED, "份额数量无效"),
    INVALID_ASSETS(1011, ErrorCategory.REJECTED, "资产数量无效"),
    INSUFFICIENT_SHARES(1012, ErrorCategory.REJECTED, "份额余额不足"),
    INSUFFICIENT_ASSETS(1013, ErrorCategory.REJECTED, "可用资产不足"),
    NOT_COLLATERALIZED(1014, ErrorCategory.REJECTED, "金库尚未完成首次收割"),
    NOT_HARVESTED(1015, ErrorCategory.REJECTED, "金库落后超过一代收益根，需先收割"),
    INVALID_TICKET(1016, ErrorCategory.REJECTED, "退出票据不存在"),
    VAULT_EXISTS(1017, ErrorCategory.REJECTED, "金库已存在"),
    VAULT_NOT_FOUND(1018, ErrorCategory.REJECTED, "金库不存在"),
    INVALID_FEE(1019, ErrorCategory.REJECTED, "手续费比例无效"),
    COLLATERALIZED(1020, ErrorCategory.REJECTED, "金库已抵押，只能通过退出队列赎回"),

    ARITHMETIC_OVERFLOW(2001, ErrorCategory.FATAL_ARITHMETIC, "算术溢出"),
    ARITHMETIC_UNDERFLOW(2002, ErrorCategory.FATAL_ARITHMETIC, "算术下溢"),
    DIVISION_BY_ZERO(2003, ErrorCategory.FATAL_ARITHMETIC, "除零"),
    OVER_CLAIM(2004, ErrorCategory.FATAL_ARITHMETIC, "领取资产超过未领取总额"),

    STORAGE_FAILURE(3001, ErrorCategory.STORAGE, "日志存储失败");

    private final int code;
    private final ErrorCategory category;
    private final String desc;

    ErrorType(int code, ErrorCategory category, String desc) {
        this.code = code;
        this.category = category;
        this.desc = desc;
    }

    public boolean isRejection() {
        return category == ErrorCategory.REJECTED;
    }
}
