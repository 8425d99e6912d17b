package com.streamwarden.moderation.policy;

/**
 * Ordered from mildest to harshest.
 */
public enum PunishmentKind {
    NONE,
    DELETE,
    PURGE,
    TIMEOUT,
    BAN;

    public int severity() {
        return ordinal();
    }
}
