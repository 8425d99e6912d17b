package com.streamwarden.app.plugin;

import com.streamwarden.app.commands.CommandHandler;
import com.streamwarden.app.commands.CommandProcessor;
import com.streamwarden.app.commands.RegisteredCommand;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.permission.PermissionService;
import com.streamwarden.permission.registry.RegisteredPermission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loaded plugins and what they registered. Unloading a plugin removes its
 * commands and unregisters its permission names, which also strips them from
 * every permission group.
 */
@Slf4j
@Component
public class PluginRegistry {

    private final CommandProcessor commandProcessor;
    private final PermissionService permissionService;
    private final Map<String, WardenPlugin> plugins = new ConcurrentHashMap<>();

    public PluginRegistry(CommandProcessor commandProcessor, PermissionService permissionService) {
        this.commandProcessor = commandProcessor;
        this.permissionService = permissionService;
    }

    /**
     * @return false if a plugin with the same id is already loaded
     */
    public boolean load(WardenPlugin plugin) {
        String id = plugin.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("plugin id required");
        }
        if (plugins.putIfAbsent(id, plugin) != null) {
            log.warn("Plugin {} already loaded", id);
            return false;
        }
        try {
            plugin.register(new Api(id));
        } catch (RuntimeException e) {
            log.error("Plugin {} failed to register: {}", id, e.getMessage(), e);
            removeRegistrations(id);
            plugins.remove(id);
            return false;
        }
        log.info("Loaded plugin {} ({} {})", id, plugin.getName(), plugin.getVersion());
        return true;
    }

    /**
     * @return false if no such plugin is loaded
     */
    public boolean unload(String pluginId) {
        WardenPlugin plugin = plugins.remove(pluginId);
        if (plugin == null) {
            return false;
        }
        removeRegistrations(pluginId);
        try {
            plugin.onUnload();
        } catch (RuntimeException e) {
            log.error("Plugin {} failed during unload: {}", pluginId, e.getMessage(), e);
        }
        log.info("Unloaded plugin {}", pluginId);
        return true;
    }

    public void unloadAll() {
        for (String id : new ArrayList<>(plugins.keySet())) {
            unload(id);
        }
    }

    public Optional<WardenPlugin> find(String pluginId) {
        return Optional.ofNullable(plugins.get(pluginId));
    }

    public Collection<WardenPlugin> loaded() {
        return List.copyOf(plugins.values());
    }

    private void removeRegistrations(String pluginId) {
        int commands = commandProcessor.unregisterOwnedBy(pluginId);
        int permissions = 0;
        for (RegisteredPermission permission : permissionService.registry().ownedBy(pluginId)) {
            if (permissionService.unregisterPermission(permission.name())) {
                permissions++;
            }
        }
        log.debug("Removed {} commands and {} permission names of plugin {}", commands, permissions, pluginId);
    }

    private class Api implements PluginApi {

        private final String pluginId;

        Api(String pluginId) {
            this.pluginId = pluginId;
        }

        @Override
        public String pluginId() {
            return pluginId;
        }

        @Override
        public boolean registerPermission(String permissionName, String description) {
            return permissionService.registerPermission(permissionName, description, pluginId);
        }

        @Override
        public boolean registerCommand(String name, UserLevels defaultLevel, int argDepth, String description,
                CommandHandler handler) {
            return commandProcessor.register(
                    new RegisteredCommand(name, pluginId, defaultLevel, argDepth, description, handler));
        }
    }
}
