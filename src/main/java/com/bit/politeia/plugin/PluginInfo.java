package com.bit.politeia.plugin;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 插件清单条目
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PluginInfo {
    private String id;
    private String version;
    private List<PluginSetting> settings;
    private List<String> commands;
}
