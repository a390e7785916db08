package com.bit.politeia.plugin;

import com.bit.politeia.exception.ErrorType;
import com.bit.politeia.exception.PoliteiaException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 插件注册器：插件ID -> 插件，插件ID+命令名 -> 命令。线程安全
 */
@Slf4j
@Component
public class PluginRegistry {
    private final Map<String, Plugin> plugins = new ConcurrentHashMap<>();
    // "插件ID/命令名" -> 命令
    private final Map<String, PluginCommand> commands = new ConcurrentHashMap<>();

    public void batchRegister(Collection<? extends Plugin> toRegister) {
        if (CollectionUtils.isEmpty(toRegister)) {
            log.warn("没有需要注册的插件");
            return;
        }
        for (Plugin plugin : toRegister) {
            try {
                register(plugin);
            } catch (IllegalArgumentException e) {
                log.error("注册插件失败 | 插件: {} | 原因: {}", plugin.getId(), e.getMessage());
            }
        }
    }

    /**
     * @throws IllegalArgumentException 插件为空、ID重复或命令名重复
     */
    public void register(Plugin plugin) {
        if (plugin == null || plugin.getId() == null) {
            throw new IllegalArgumentException("插件及其ID不能为空");
        }
        if (plugins.containsKey(plugin.getId())) {
            throw new IllegalArgumentException("插件ID重复: " + plugin.getId());
        }
        Map<String, PluginCommand> pluginCommands = new HashMap<>();
        for (PluginCommand command : plugin.getCommands()) {
            String key = commandKey(plugin.getId(), command.getName());
            if (pluginCommands.put(key, command) != null || commands.containsKey(key)) {
                throw new IllegalArgumentException("插件命令重复: " + key);
            }
        }
        if (plugins.putIfAbsent(plugin.getId(), plugin) != null) {
            throw new IllegalArgumentException("插件ID重复: " + plugin.getId());
        }
        commands.putAll(pluginCommands);
        log.info("插件注册成功 | ID: {} | 版本: {} | 命令: {}", plugin.getId(), plugin.getVersion(),
                plugin.getCommands().stream().map(PluginCommand::getName).collect(Collectors.toList()));
    }

    /**
     * 按插件ID与命令名分发
     * @throws PoliteiaException PLUGIN_NOT_FOUND / COMMAND_NOT_FOUND，或命令自身的失败
     */
    public String execute(String pluginId, String command, String payload) {
        if (!plugins.containsKey(pluginId)) {
            throw new PoliteiaException(ErrorType.PLUGIN_NOT_FOUND, "插件未注册: " + pluginId);
        }
        PluginCommand cmd = commands.get(commandKey(pluginId, command));
        if (cmd == null) {
            throw new PoliteiaException(ErrorType.COMMAND_NOT_FOUND, "插件 " + pluginId + " 不支持命令: " + command);
        }
        return cmd.execute(payload);
    }

    public List<PluginInfo> inventory() {
        List<PluginInfo> result = new ArrayList<>();
        for (Plugin plugin : plugins.values()) {
            result.add(new PluginInfo(plugin.getId(), plugin.getVersion(), plugin.getSettings(),
                    plugin.getCommands().stream().map(PluginCommand::getName).collect(Collectors.toList())));
        }
        result.sort(Comparator.comparing(PluginInfo::getId));
        return result;
    }

    public boolean isRegistered(String pluginId) {
        return plugins.containsKey(pluginId);
    }

    private static String commandKey(String pluginId, String command) {
        return pluginId + "/" + command;
    }
}
