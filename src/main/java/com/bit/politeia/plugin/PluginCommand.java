package com.bit.politeia.plugin;

/**
 * 插件命令：字符串负载进，字符串负载出（JSON 编码的请求/响应体）
 */
public interface PluginCommand {

    String getName();

    /**
     * @throws com.bit.politeia.exception.PoliteiaException 整个调用失败时
     */
    String execute(String payload);
}
