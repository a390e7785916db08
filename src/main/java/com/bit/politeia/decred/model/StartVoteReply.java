package com.bit.politeia.decred.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 投票会话描述：起止高度、快照区块与冻结的选民票列表，创建后不再修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StartVoteReply {
    @JsonProperty("startblockheight")
    private String startBlockHeight;
    @JsonProperty("startblockhash")
    private String startBlockHash;
    @JsonProperty("endheight")
    private String endHeight;
    @JsonProperty("eligibletickets")
    private List<String> eligibleTickets;
}
