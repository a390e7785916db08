package com.bit.politeia.exception;

/**
 * 投票子系统统一异常：携带错误类型，便于调用方分类处理
 */
public class PoliteiaException extends RuntimeException {

    private final ErrorType errorType;

    public PoliteiaException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public PoliteiaException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }
}
