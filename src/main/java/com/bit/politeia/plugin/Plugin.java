package com.bit.politeia.plugin;

import java.util.List;

/**
 * 可插拔命令集合：一个插件暴露若干按名称分发的命令
 */
public interface Plugin {

    String getId();

    String getVersion();

    /**
     * 对外只读展示的插件设置
     */
    List<PluginSetting> getSettings();

    List<PluginCommand> getCommands();
}
