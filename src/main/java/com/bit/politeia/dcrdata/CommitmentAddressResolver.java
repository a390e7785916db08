package com.bit.politeia.dcrdata;

import com.bit.politeia.config.PoliteiaProperties;
import com.bit.politeia.exception.OracleUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 解析票的最大承诺地址，作为该票投票签名的期望签名者。
 * 承诺地址写在购票交易里，链上不可变，所以成功结果可以缓存；失败不缓存。
 */
@Slf4j
@Component
public class CommitmentAddressResolver {

    private final DcrdataClient dcrdataClient;

    private final Cache<String, String> addressCache;

    @Autowired
    public CommitmentAddressResolver(DcrdataClient dcrdataClient, PoliteiaProperties properties) {
        this.dcrdataClient = dcrdataClient;
        this.addressCache = Caffeine.newBuilder()
                .maximumSize(properties.getCommitmentCacheSize())
                .recordStats()
                .build();
    }

    /**
     * @throws OracleUnavailableException 查询失败或交易中没有承诺输出
     */
    public String largestCommitmentAddress(String ticket) {
        return addressCache.get(ticket, this::resolve);
    }

    public long cachedCount() {
        return addressCache.estimatedSize();
    }

    private String resolve(String ticket) {
        TrimmedTx tx = dcrdataClient.transaction(ticket);
        if (tx.getVout() == null) {
            throw new OracleUnavailableException("交易缺少输出: " + ticket);
        }

        String bestAddr = null;
        double bestAmount = 0.0;
        for (TrimmedTx.Vout vout : tx.getVout()) {
            TrimmedTx.ScriptPubKey script = vout.getScriptPubKey();
            if (script == null || script.getCommitamt() == null) {
                continue;
            }
            if (script.getCommitamt() > bestAmount) {
                List<String> addresses = script.getAddresses();
                if (addresses == null || addresses.isEmpty()) {
                    log.error("承诺输出缺少地址: tx={} n={}", tx.getTxid(), vout.getN());
                    continue;
                }
                bestAddr = addresses.get(0);
                bestAmount = script.getCommitamt();
            }
        }

        if (bestAddr == null) {
            throw new OracleUnavailableException("未找到最大承诺地址: " + tx.getTxid());
        }
        return bestAddr;
    }
}
