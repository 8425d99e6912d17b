package com.streamwarden.app.config;

import com.streamwarden.app.plugin.PluginRegistry;
import com.streamwarden.app.plugin.WardenPlugin;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads every {@link WardenPlugin} bean into the {@link PluginRegistry} at
 * startup and unloads them on shutdown.
 */
@Slf4j
@Component
public class PluginBootstrap {

    private final PluginRegistry registry;
    private final List<WardenPlugin> plugins;

    public PluginBootstrap(PluginRegistry registry, List<WardenPlugin> plugins) {
        this.registry = registry;
        this.plugins = plugins;
    }

    @PostConstruct
    public void init() {
        int loaded = 0;
        for (WardenPlugin plugin : plugins) {
            if (registry.load(plugin)) {
                loaded++;
            }
        }
        log.info("Plugins loaded: {} of {}", loaded, plugins.size());
    }

    @PreDestroy
    public void shutdown() {
        registry.unloadAll();
    }
}
