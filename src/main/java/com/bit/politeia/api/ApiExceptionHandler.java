package com.bit.politeia.api;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import com.bit.politeia.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.EnumSet;
import java.util.Set;

/**
 * PoliteiaException -> Result：可重试 503，请求错误 400，其余 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Set<ErrorType> REQUEST_ERRORS = EnumSet.of(
            ErrorType.MALFORMED_REQUEST,
            ErrorType.MALFORMED_TOKEN,
            ErrorType.INVALID_ADDRESS,
            ErrorType.INVALID_SIGNATURE,
            ErrorType.VOTE_ALREADY_STARTED,
            ErrorType.RECORD_NOT_FOUND,
            ErrorType.PLUGIN_NOT_FOUND,
            ErrorType.COMMAND_NOT_FOUND);

    @ExceptionHandler(PoliteiaException.class)
    public ResponseEntity<Result<Void>> handlePoliteiaException(PoliteiaException e) {
        int status = httpStatus(e.getErrorType());
        if (status == Result.SC_INTERNAL_SERVER_ERROR_500) {
            log.error("插件命令执行失败: {}", e.getMessage(), e);
        } else {
            log.warn("插件命令被拒绝: {}", e.getMessage());
        }
        Result<Void> result = Result.error(status, e.getMessage());
        result.setErrorType(e.getErrorType().name());
        return ResponseEntity.status(status).body(result);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        Result<Void> result = Result.error(Result.SC_BAD_REQUEST_400, "请求体无法解析");
        result.setErrorType(ErrorType.MALFORMED_REQUEST.name());
        return ResponseEntity.badRequest().body(result);
    }

    static int httpStatus(ErrorType type) {
        if (type.isRetryable()) {
            return Result.SC_SERVICE_UNAVAILABLE_503;
        }
        if (REQUEST_ERRORS.contains(type)) {
            return Result.SC_BAD_REQUEST_400;
        }
        return Result.SC_INTERNAL_SERVER_ERROR_500;
    }
}
