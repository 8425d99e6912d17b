package com.streamwarden.moderation.policy;

import java.util.ArrayList;

/**
 * Starting values for a channel that has never been configured. Every filter
 * starts disabled.
 */
public final class ModerationDefaults {

    public static final int WARNING_TIMEOUT_SECONDS = 5;
    public static final int REPEAT_TIMEOUT_SECONDS = 600;

    private ModerationDefaults() {
    }

    public static ChannelModerationSettings channel(String channelId) {
        ChannelModerationSettings settings = new ChannelModerationSettings(channelId);
        for (FilterKind kind : FilterKind.values()) {
            settings.putPolicy(kind, policy(kind));
        }
        return settings;
    }

    public static FilterPolicy policy(FilterKind kind) {
        FilterPolicy policy = new FilterPolicy();
        policy.setEnabled(false);
        if (kind.isTiered()) {
            String reason = describe(kind);
            policy.setWarningTier(PunishmentSpec.timeout(WARNING_TIMEOUT_SECONDS, reason + " (warning)"));
            policy.setRepeatTier(PunishmentSpec.timeout(REPEAT_TIMEOUT_SECONDS, reason));
        }
        switch (kind) {
            case CAPS -> {
                policy.setMinimumMessageLength(10);
                policy.setMaximumPercentage(70);
            }
            case SYMBOLS -> {
                policy.setMinimumMessageLength(10);
                policy.setMaximumPercentage(50);
                policy.setMaximumGrouped(10);
            }
            case LENGTHY_MESSAGE -> policy.setMaximumLength(300);
            case REPETITION -> {
                policy.setMinimumMessageLength(10);
                policy.setMaximumRepeatingCharacters(15);
                policy.setMaximumRepeatingWords(5);
            }
            case EMOTES -> {
                policy.setMaximumAllowed(10);
                policy.setRemoveOnlyEmotes(false);
            }
            case ONE_MAN_SPAM -> {
                policy.setMaximumMessages(10);
                policy.setResetWindowSeconds(30);
            }
            case LINKS -> policy.setPermitSeconds(60);
            case BLACKLIST -> policy.setBlacklist(new ArrayList<>());
            default -> {
            }
        }
        return policy;
    }

    private static String describe(FilterKind kind) {
        return switch (kind) {
            case CAPS -> "Excessive caps";
            case SYMBOLS -> "Excessive symbols";
            case ZALGO -> "Zalgo text";
            case LINKS -> "Posting links";
            case LENGTHY_MESSAGE -> "Message too long";
            case REPETITION -> "Repetition";
            case EMOTES -> "Excessive emotes";
            case FAKE_PURGE -> "Fake purge";
            case ACTION_MESSAGE -> "Coloured message";
            case ONE_MAN_SPAM -> "Spamming";
            case BLACKLIST -> "Blacklisted";
        };
    }
}
