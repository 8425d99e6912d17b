package com.streamwarden.app.plugin;

/**
 * A bot extension. Plugins register the permission names they check and the
 * chat commands they handle through the {@link PluginApi}; everything a
 * plugin registered is removed again when it is unloaded.
 */
public interface WardenPlugin {

    /** Unique plugin identifier. */
    String getId();

    /** Human-readable plugin name. */
    String getName();

    default String getVersion() {
        return "1.0.0";
    }

    default String getDescription() {
        return "";
    }

    /**
     * Called once when the plugin is loaded.
     */
    void register(PluginApi api);

    /**
     * Called after the plugin's commands and permission names have been
     * removed.
     */
    default void onUnload() {
    }
}
