package com.bit.politeia.exception;

/**
 * dcrdata 查询失败：传输错误、非200响应或JSON解码失败
 */
public class OracleUnavailableException extends PoliteiaException {

    public OracleUnavailableException(String message) {
        super(ErrorType.ORACLE_UNAVAILABLE, message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(ErrorType.ORACLE_UNAVAILABLE, message, cause);
    }
}
