package com.bit.vault.api;

import com.bit.vault.exception.VaultException;
import com.bit.vault.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把核心异常映射为带稳定错误码的 Result
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(VaultException.class)
    public ResponseEntity<Result<Void>> handleVaultException(VaultException e) {
        if (e.getErrorType().isRejection()) {
            log.warn("请求被拒绝: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(Result.error(e.getErrorType().getCode(), e.getErrorType().name(), e.getMessage()));
        }
        log.error("请求处理失败: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error(e.getErrorType().getCode(), e.getErrorType().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Result.error(HttpStatus.BAD_REQUEST.value(), e.getMessage()));
    }
}
