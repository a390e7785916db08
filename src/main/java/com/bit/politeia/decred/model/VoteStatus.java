package com.bit.politeia.decred.model;

/**
 * 单张投票的拒绝原因；接受的投票不带 errorstatus
 */
public enum VoteStatus {
    DUPLICATE_IN_BATCH("duplicate vote in batch"),
    MALFORMED_VOTE("malformed vote"),
    ORACLE_ERROR("could not resolve ticket commitment address"),
    INVALID_SIGNATURE("could not verify message"),
    ALREADY_VOTED("ticket already voted on proposal"),
    TOKEN_FAILED("proposal vote ledger unavailable");

    private final String message;

    VoteStatus(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
