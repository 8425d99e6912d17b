package com.streamwarden.app.plugin;

import com.streamwarden.app.commands.CommandHandler;
import com.streamwarden.common.level.UserLevels;

/**
 * Registration surface handed to {@link WardenPlugin#register}.
 */
public interface PluginApi {

    String pluginId();

    /**
     * Declare a permission name the plugin checks, so it can be granted to
     * permission groups.
     *
     * @return false if another plugin already owns the name
     */
    boolean registerPermission(String permissionName, String description);

    /**
     * Register a chat command. The command name, followed by the first
     * {@code argDepth} arguments, forms the {@code can_...} permission name
     * that can grant the command beyond {@code defaultLevel}.
     *
     * @return false if the command name is taken
     */
    boolean registerCommand(String name, UserLevels defaultLevel, int argDepth, String description,
            CommandHandler handler);
}
