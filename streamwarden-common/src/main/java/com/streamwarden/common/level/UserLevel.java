package com.streamwarden.common.level;

import java.util.Locale;

/**
 * A single user-level bit.
 * <p>
 * Moderator, TwitchAdmin and TwitchStaff are ranked (a higher rank implies
 * every lower one). Subscriber and VIP are plain flags. Viewer means
 * "anyone", Broadcaster always satisfies, and Custom asks the resolver to
 * consult named permissions.
 */
public enum UserLevel {
    VIEWER(0),
    SUBSCRIBER(0),
    VIP(0),
    MODERATOR(1),
    TWITCH_ADMIN(2),
    TWITCH_STAFF(3),
    BROADCASTER(0),
    CUSTOM(0);

    private final int rank;

    UserLevel(int rank) {
        this.rank = rank;
    }

    /** Position in the ranked sub-hierarchy, 0 for non-ranked levels. */
    public int rank() {
        return rank;
    }

    public boolean isRanked() {
        return rank > 0;
    }

    public boolean isFlag() {
        return this == SUBSCRIBER || this == VIP;
    }

    /**
     * Parse a level name. Accepts "twitchStaff", "TWITCH_STAFF", "twitch-staff"
     * and "TwitchStaff".
     */
    public static UserLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("user level name required");
        }
        String key = raw.trim().replace("-", "").replace("_", "").replace(" ", "")
                .toLowerCase(Locale.ROOT);
        for (UserLevel level : values()) {
            if (level.name().replace("_", "").toLowerCase(Locale.ROOT).equals(key)) {
                return level;
            }
        }
        throw new IllegalArgumentException("unknown user level: " + raw);
    }
}
