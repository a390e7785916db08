package com.bit.politeia.plugin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Spring 容器初始化完成后，自动注册所有 {@link Plugin} Bean
 */
@Slf4j
@Component
public class PluginAutoRegister implements ApplicationContextAware {

    private ApplicationContext applicationContext;

    @Autowired
    private PluginRegistry pluginRegistry;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @EventListener(ContextRefreshedEvent.class)
    public void registerPluginsAfterSpringInit() {
        log.info("开始自动扫描并注册插件...");
        Map<String, Plugin> beans = applicationContext.getBeansOfType(Plugin.class);
        for (Plugin plugin : beans.values()) {
            if (pluginRegistry.isRegistered(plugin.getId())) {
                // 子容器刷新会再次触发事件
                continue;
            }
            pluginRegistry.batchRegister(List.of(plugin));
        }
        log.info("插件自动注册完成 | 总数量: {}", pluginRegistry.inventory().size());
    }
}
