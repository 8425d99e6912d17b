package com.streamwarden.common.level;

/**
 * Channel-independent standing of a user with the bot itself.
 */
public enum GlobalStanding {
    NONE,
    /** Vetoes every permission check. */
    BANNED,
    /** Bypasses every permission check. */
    SUPER_ADMIN
}
