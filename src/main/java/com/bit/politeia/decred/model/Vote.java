package com.bit.politeia.decred.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * startvote 请求：提案令牌与投票位定义
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Vote {
    private String token;
    private long mask;                               // 有效投票位掩码
    private List<VoteOption> options = new ArrayList<>();
}
