package com.bit.politeia.decred.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoteOption {
    private String id;           // 选项标识，如 "yes"
    private String description;
    private long bits;           // 该选项对应的投票位
}
