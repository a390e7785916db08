package com.bit.politeia.ledger;

import com.bit.politeia.decred.model.CastVote;

/**
 * 已打开的单个提案账本
 */
public interface LedgerHandle extends AutoCloseable {

    String getToken();

    /**
     * 从头解码全部记录，重建去重索引
     * @throws com.bit.politeia.exception.LedgerCorruptException 记录无法解码或同一张票出现两次
     */
    DedupIndex replay();

    /**
     * 在文件末尾追加一条记录并落盘。调用前必须持有 {@link StorageLock}
     */
    void append(CastVote vote);

    @Override
    void close();
}
