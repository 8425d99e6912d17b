package com.streamwarden.permission;

import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives a channel level from Twitch chat badges. The highest badge wins:
 * staff, admin, broadcaster, moderator, subscriber, vip. Without a known
 * badge the user is a plain viewer.
 */
public final class BadgeLevelParser {

    private static final List<Map.Entry<String, UserLevel>> PRECEDENCE = List.of(
            Map.entry("staff", UserLevel.TWITCH_STAFF),
            Map.entry("admin", UserLevel.TWITCH_ADMIN),
            Map.entry("broadcaster", UserLevel.BROADCASTER),
            Map.entry("moderator", UserLevel.MODERATOR),
            Map.entry("subscriber", UserLevel.SUBSCRIBER),
            Map.entry("vip", UserLevel.VIP));

    private BadgeLevelParser() {
    }

    /**
     * @param badges badge names as sent in the IRC {@code badges} tag, with or
     *               without the {@code /version} suffix
     */
    public static UserLevels parse(Map<String, String> badges) {
        if (badges == null || badges.isEmpty()) {
            return UserLevels.VIEWER;
        }
        for (Map.Entry<String, UserLevel> candidate : PRECEDENCE) {
            if (badges.containsKey(candidate.getKey())) {
                return UserLevels.of(candidate.getValue());
            }
        }
        return UserLevels.VIEWER;
    }

    /**
     * Parse the raw tag form, e.g. {@code "moderator/1,subscriber/12"}.
     */
    public static UserLevels parseTag(String badgesTag) {
        if (badgesTag == null || badgesTag.isBlank()) {
            return UserLevels.VIEWER;
        }
        Map<String, String> badges = new LinkedHashMap<>();
        for (String part : badgesTag.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int slash = trimmed.indexOf('/');
            String name = (slash >= 0 ? trimmed.substring(0, slash) : trimmed).toLowerCase(Locale.ROOT);
            badges.put(name, slash >= 0 ? trimmed.substring(slash + 1) : "1");
        }
        return parse(badges);
    }
}
