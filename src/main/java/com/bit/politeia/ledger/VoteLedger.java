package com.bit.politeia.ledger;

/**
 * 按提案划分的只追加投票账本
 */
public interface VoteLedger {

    /**
     * 打开（不存在则创建）提案的账本，调用方负责关闭句柄
     * @throws com.bit.politeia.exception.PoliteiaException MALFORMED_TOKEN / RECORD_NOT_FOUND / LEDGER_IO
     */
    LedgerHandle open(String token);
}
