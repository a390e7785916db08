package com.bit.politeia.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 插件命令请求：payload 原样交给插件命令
 */
@Data
@NoArgsConstructor
public class PluginCommandRequest {
    private String id;
    private String command;
    @JsonProperty("commandid")
    private String commandId;
    private String payload;
}
