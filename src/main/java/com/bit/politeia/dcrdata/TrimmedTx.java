package com.bit.politeia.dcrdata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * dcrdata /api/tx/{hash} 返回的交易，购票交易的输出里带有承诺金额与地址
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrimmedTx {
    private String txid;
    private List<Vout> vout = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Vout {
        private double value;
        private long n;
        @JsonProperty("scriptPubKey")
        private ScriptPubKey scriptPubKey;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScriptPubKey {
        private String type;
        private List<String> addresses;
        private Double commitamt;//仅承诺输出(sstxcommitment)存在
    }
}
