package com.streamwarden.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type for StreamWarden.
 */
@Data
public class WardenConfig {

    /** Bot identity and command settings. */
    private BotConfig bot;

    /** Moderation engine settings. */
    private ModerationConfig moderation;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class BotConfig {
        /** Login name the bot uses in chat. */
        private String login = "streamwarden";
        /** Prefix that marks a chat message as a command. */
        private String commandPrefix = "!";
        /** User ids that receive {@code SUPER_ADMIN} standing at startup. */
        private List<String> superAdmins;
    }

    @Data
    public static class ModerationConfig {
        /** Directory holding one {@code <channelId>.json} settings document per channel. */
        private String policyDir = "~/.streamwarden/moderation";
        /** How long chat messages stay in the spam-detection cache. */
        private int messageRetentionSeconds = 300;
        /** Interval of the cache/warning cleanup job. */
        private int cleanupIntervalSeconds = 300;
        /** Escalation window used when a channel document does not set one. */
        private int defaultWarningWindowSeconds = 86_400;
        /** Entries kept per channel in the moderation log. */
        private int moderationLogSize = 200;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
        /** Subsystem prefixes to log; empty logs everything. */
        private List<String> subsystems;
    }
}
