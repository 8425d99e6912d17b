package com.streamwarden.common.level;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-channel identity snapshot used for policy checks.
 *
 * @param userId           platform user id
 * @param globalStanding   bot-wide standing
 * @param levelInChannel   levels held in this channel, re-derived from badges on every message
 * @param groupMemberships ids of the custom permission groups the user belongs to
 */
public record Actor(
        String userId,
        GlobalStanding globalStanding,
        UserLevels levelInChannel,
        Set<String> groupMemberships) {

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId required");
        }
        globalStanding = globalStanding != null ? globalStanding : GlobalStanding.NONE;
        levelInChannel = levelInChannel != null ? levelInChannel : UserLevels.VIEWER;
        groupMemberships = groupMemberships == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(groupMemberships));
    }

    public static Actor viewer(String userId) {
        return new Actor(userId, GlobalStanding.NONE, UserLevels.VIEWER, Set.of());
    }

    public Actor withLevel(UserLevels level) {
        return new Actor(userId, globalStanding, level, groupMemberships);
    }

    public Actor withStanding(GlobalStanding standing) {
        return new Actor(userId, standing, levelInChannel, groupMemberships);
    }

    public Actor withMembership(String groupId) {
        if (groupMemberships.contains(groupId)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(groupMemberships);
        next.add(groupId);
        return new Actor(userId, globalStanding, levelInChannel, next);
    }

    public Actor withoutMembership(String groupId) {
        if (!groupMemberships.contains(groupId)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(groupMemberships);
        next.remove(groupId);
        return new Actor(userId, globalStanding, levelInChannel, next);
    }
}
