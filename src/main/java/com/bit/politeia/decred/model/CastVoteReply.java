package com.bit.politeia.decred.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单张投票的处理结果：成功时带服务反签，失败时带错误描述
 */
@Data
@NoArgsConstructor
public class CastVoteReply {
    @JsonProperty("clientsignature")
    private String clientSignature;  // 客户端提交的签名（原样返回）
    private String signature;        // 服务对 clientsignature 的 Ed25519 反签（hex）
    private String error;            // 失败原因，成功为空
    @JsonProperty("errorstatus")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private VoteStatus errorStatus;  // 失败分类，成功为空
}
