package com.bit.politeia.dcrdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * dcrdata /api/block/* 返回的区块摘要，只保留投票需要的字段
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockDataBasic {
    private long height;
    private String hash;
    private long time;
}
