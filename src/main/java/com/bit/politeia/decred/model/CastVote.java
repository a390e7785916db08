package com.bit.politeia.decred.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一张票对提案的投票，也是账本中的一行记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CastVote {
    private String token;       // 提案令牌（hex）
    private String ticket;      // 票交易哈希
    @JsonProperty("votebit")
    private String voteBit;     // 选中的投票位（hex）
    private String signature;   // 对 token+ticket+votebit 的紧凑签名（hex）

    /**
     * 客户端签名的规范消息
     */
    public String signedMessage() {
        return token + ticket + voteBit;
    }
}
