package com.streamwarden.permission.actor;

import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.GlobalStanding;
import com.streamwarden.common.level.UserLevels;

import java.util.Optional;

/**
 * Per-channel user records. Global standing is tracked per user and merged
 * into every channel view.
 */
public interface ActorDirectory {

    /**
     * Actor as seen in one channel. A user with no channel record but a
     * non-default global standing is returned as a viewer so the standing
     * still applies.
     */
    Optional<Actor> find(String channelId, String userId);

    /**
     * Record the level derived from the badges of a chat message, creating
     * the record on first sight.
     */
    Actor observe(String channelId, String userId, UserLevels levelInChannel);

    void setGlobalStanding(String userId, GlobalStanding standing);

    GlobalStanding globalStanding(String userId);

    Actor addMembership(String channelId, String userId, String groupId);

    /**
     * @return true if the user was a member
     */
    boolean removeMembership(String channelId, String userId, String groupId);

    /**
     * Remove the group from every actor in the channel.
     *
     * @return number of actors changed
     */
    int removeGroupFromAll(String channelId, String groupId);
}
