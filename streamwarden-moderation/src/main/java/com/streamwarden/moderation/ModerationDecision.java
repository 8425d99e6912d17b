package com.streamwarden.moderation;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.PunishmentSpec;

/**
 * A punishment chosen for one message by one filter.
 *
 * @param rule blacklist entry label for blacklist hits, otherwise the filter id
 */
public record ModerationDecision(FilterKind kind, Tier tier, PunishmentSpec punishment, String rule) {

    public enum Tier {
        WARNING,
        REPEAT,
        /** Blacklist entries are one-shot and never tiered. */
        FIXED
    }

    public boolean isHarsherThan(ModerationDecision other) {
        return other == null || punishment.isHarsherThan(other.punishment);
    }
}
