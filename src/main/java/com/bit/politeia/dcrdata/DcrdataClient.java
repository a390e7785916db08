package com.bit.politeia.dcrdata;

import java.util.List;

/**
 * 区块数据只读预言机（dcrdata）。任何传输或解码错误都抛出 OracleUnavailableException
 */
public interface DcrdataClient {

    /**
     * 当前最佳区块
     */
    BlockDataBasic bestBlock();

    /**
     * 指定高度的区块
     */
    BlockDataBasic block(long height);

    /**
     * 指定区块哈希时的完整票池（已排序），即投票选民
     */
    List<String> ticketPool(String blockHash);

    /**
     * 按哈希查询交易
     */
    TrimmedTx transaction(String txHash);
}
