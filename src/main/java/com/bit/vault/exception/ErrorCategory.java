package com.bit.vault.exception;

/**
 * 错误大类：调用方可据此区分"可修正后重试"与"整笔操作被拒绝"
 */
public enum ErrorCategory {
    /**
     * 策略拒绝：调用方输入或时机不对，状态未被修改，修正后可重试
     */
    REJECTED,
    /**
     * 算术致命错误：溢出/下溢/除零，整笔复合操作中止，从不部分生效
     */
    FATAL_ARITHMETIC,
    /**
     * 存储失败：日志写入或读取异常
     */
    STORAGE
}
