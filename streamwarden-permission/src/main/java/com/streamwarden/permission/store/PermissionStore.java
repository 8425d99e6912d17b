package com.streamwarden.permission.store;

import com.streamwarden.permission.PermissionGroup;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage boundary for permission groups.
 * <p>
 * Implementations serialize read-modify-write per group: two {@link #update}
 * calls on the same group never lose each other's change, while updates to
 * different groups proceed independently.
 */
public interface PermissionStore {

    record CreateResult(PermissionGroup group, boolean created) {
    }

    Optional<PermissionGroup> findById(String groupId);

    /** Case-insensitive lookup within one channel. */
    Optional<PermissionGroup> findByName(String channelId, String name);

    List<PermissionGroup> findByChannel(String channelId);

    /**
     * Create a group, or return the existing one when the name is already taken
     * in the channel.
     */
    CreateResult create(String channelId, String name);

    /**
     * Atomically replace a group with {@code change.apply(current)}. Empty when
     * the group does not exist.
     */
    Optional<PermissionGroup> update(String groupId, UnaryOperator<PermissionGroup> change);

    boolean delete(String groupId);

    /**
     * Remove every entry for the normalized name from every group.
     *
     * @return number of groups changed
     */
    int removePermissionFromAllGroups(String normalizedName);
}
