package com.bit.politeia.decred;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 快照区块及其票池（投票选民）
 */
@Data
@AllArgsConstructor
public class TicketSnapshot {
    private long blockHeight;
    private String blockHash;
    private List<String> tickets;
}
