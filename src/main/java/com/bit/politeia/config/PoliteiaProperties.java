package com.bit.politeia.config;

import com.bit.politeia.crypto.DecredNet;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * 投票后端配置，通过构造注入传给各组件，不使用全局可变设置表
 */
@Data
@Component
@ConfigurationProperties(prefix = "politeia")
public class PoliteiaProperties {
    private DecredNet network = DecredNet.TESTNET3;
    private String dcrdataUrl;//为空时使用网络默认地址
    private String dataDir = "data/politeiad";//记录目录与身份文件的根目录
    private Duration lockTimeout = Duration.ofSeconds(5);//获取全局写锁的最长等待
    private int voteDuration = 2016;//投票持续区块数，主网约一周
    private Integer ticketMaturity;//为空时使用网络常量
    private Duration httpTimeout = Duration.ofSeconds(10);
    private int verifyThreads = Runtime.getRuntime().availableProcessors();
    private long commitmentCacheSize = 100_000;

    public String resolveDcrdataUrl() {
        String url = dcrdataUrl == null || dcrdataUrl.isBlank() ? network.getDefaultDcrdataUrl() : dcrdataUrl;
        return url.endsWith("/") ? url : url + "/";
    }

    public int resolveTicketMaturity() {
        return ticketMaturity != null ? ticketMaturity : network.getTicketMaturity();
    }

    public Path vettedDir() {
        return Paths.get(dataDir, "vetted");
    }

    public Path identityFile() {
        return Paths.get(dataDir, "identity.json");
    }
}
