package com.bit.vault.exception;

/**
 * 金库核心统一异常：封装错误类型与错误信息，便于 API 层映射为稳定错误码
 */
public class VaultException extends RuntimeException {

    private final ErrorType errorType;

    public VaultException(ErrorType errorType, String message) {
        super("[" + errorType.name() + "]：" + message);
        this.errorType = errorType;
    }

    public VaultException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.name() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
