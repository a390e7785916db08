package com.bit.politeia.exception;

import lombok.Getter;

/**
 * 账本数据完整性被破坏（无法解码的记录或重复的票），唯一性约束不再可信
 */
@Getter
public class LedgerCorruptException extends PoliteiaException {

    private final String token;

    // 出错的行号（从1开始）
    private final long line;

    public LedgerCorruptException(String token, long line, String message, Throwable cause) {
        super(ErrorType.LEDGER_CORRUPT, "token=" + token + " line=" + line + " " + message, cause);
        this.token = token;
        this.line = line;
    }
}
