package com.bit.politeia.record;

import java.util.List;
import java.util.Map;

/**
 * 提案记录存储（外部协作方）。投票子系统只读写已审核记录的元数据流
 */
public interface RecordStore {

    /**
     * 读取已审核记录的全部元数据流
     * @return 流ID -> 负载
     * @throws com.bit.politeia.exception.PoliteiaException RECORD_NOT_FOUND
     */
    Map<Integer, String> getVettedMetadata(String token);

    /**
     * 一次调用内原子地删除、追加元数据流：要么全部生效，要么全部不生效
     * @throws com.bit.politeia.exception.PoliteiaException RECORD_NOT_FOUND / LEDGER_IO
     */
    void updateVettedMetadata(String token, List<Integer> removals, List<MetadataStream> additions);
}
