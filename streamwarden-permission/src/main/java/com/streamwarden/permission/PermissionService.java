package com.streamwarden.permission;

import com.streamwarden.permission.actor.ActorDirectory;
import com.streamwarden.permission.registry.PermissionRegistry;
import com.streamwarden.permission.store.PermissionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Mutation API behind the administrative commands. Every operation is atomic
 * for the single group or actor it touches. Groups are addressed by name,
 * case-insensitively, within a channel.
 */
@Slf4j
public class PermissionService {

    private final PermissionStore store;
    private final ActorDirectory actors;
    private final PermissionRegistry registry;

    public PermissionService(PermissionStore store, ActorDirectory actors, PermissionRegistry registry) {
        this.store = store;
        this.actors = actors;
        this.registry = registry;
    }

    // =========================================================================
    // Groups
    // =========================================================================

    /**
     * Create a group. When the name is already taken in the channel the
     * existing group is returned unchanged.
     */
    public PermissionGroup createGroup(String channelId, String name) {
        require(channelId, "channelId");
        require(name, "group name");
        PermissionStore.CreateResult result = store.create(channelId, name);
        if (result.created()) {
            log.info("Created permission group '{}' in channel {}", result.group().name(), channelId);
        } else {
            log.debug("Permission group '{}' already exists in channel {}", name, channelId);
        }
        return result.group();
    }

    /**
     * Delete a group after removing it from every member.
     *
     * @return false if no such group exists
     */
    public boolean deleteGroup(String channelId, String name) {
        require(channelId, "channelId");
        require(name, "group name");
        Optional<PermissionGroup> group = store.findByName(channelId, name);
        if (group.isEmpty()) {
            return false;
        }
        String groupId = group.get().id();
        int members = actors.removeGroupFromAll(channelId, groupId);
        boolean deleted = store.delete(groupId);
        log.info("Deleted permission group '{}' in channel {} ({} member(s) removed)",
                group.get().name(), channelId, members);
        return deleted;
    }

    public Optional<PermissionGroup> findGroup(String channelId, String name) {
        require(channelId, "channelId");
        require(name, "group name");
        return store.findByName(channelId, name);
    }

    public List<PermissionGroup> listGroups(String channelId) {
        require(channelId, "channelId");
        return store.findByChannel(channelId);
    }

    // =========================================================================
    // Membership
    // =========================================================================

    /**
     * @return false if the group does not exist
     */
    public boolean addMembership(String channelId, String userId, String groupName) {
        require(channelId, "channelId");
        require(userId, "userId");
        require(groupName, "group name");
        Optional<PermissionGroup> group = store.findByName(channelId, groupName);
        if (group.isEmpty()) {
            return false;
        }
        actors.addMembership(channelId, userId, group.get().id());
        log.info("Added user {} to group '{}' in channel {}", userId, group.get().name(), channelId);
        return true;
    }

    /**
     * @return false if the group does not exist or the user was not a member
     */
    public boolean removeMembership(String channelId, String userId, String groupName) {
        require(channelId, "channelId");
        require(userId, "userId");
        require(groupName, "group name");
        Optional<PermissionGroup> group = store.findByName(channelId, groupName);
        if (group.isEmpty()) {
            return false;
        }
        boolean removed = actors.removeMembership(channelId, userId, group.get().id());
        if (removed) {
            log.info("Removed user {} from group '{}' in channel {}", userId, group.get().name(), channelId);
        }
        return removed;
    }

    // =========================================================================
    // Entries
    // =========================================================================

    /**
     * Add an entry. An existing entry for the same name is left as is.
     *
     * @return false if the group does not exist
     */
    public boolean addPermission(String channelId, String groupName, String permissionName, boolean denied) {
        String name = requirePermission(permissionName);
        return updateGroup(channelId, groupName, g -> g.entry(name).isPresent() ? g : g.withEntry(name, denied),
                "add " + name);
    }

    /**
     * Set the allow/deny flag of an entry in place, adding it if missing.
     *
     * @return false if the group does not exist
     */
    public boolean updatePermission(String channelId, String groupName, String permissionName, boolean denied) {
        String name = requirePermission(permissionName);
        return updateGroup(channelId, groupName, g -> g.withEntry(name, denied),
                (denied ? "deny " : "allow ") + name);
    }

    /**
     * Remove an entry so the permission is inherited again.
     *
     * @return false if the group does not exist
     */
    public boolean removePermission(String channelId, String groupName, String permissionName) {
        String name = requirePermission(permissionName);
        return updateGroup(channelId, groupName, g -> g.withoutEntry(name), "inherit " + name);
    }

    private boolean updateGroup(String channelId, String groupName,
            UnaryOperator<PermissionGroup> change, String description) {
        require(channelId, "channelId");
        require(groupName, "group name");
        Optional<PermissionGroup> group = store.findByName(channelId, groupName);
        if (group.isEmpty()) {
            return false;
        }
        boolean updated = store.update(group.get().id(), change).isPresent();
        if (updated) {
            log.info("Group '{}' in channel {}: {}", group.get().name(), channelId, description);
        }
        return updated;
    }

    // =========================================================================
    // Registered names
    // =========================================================================

    public boolean registerPermission(String permissionName, String description, String ownerId) {
        requirePermission(permissionName);
        return registry.register(permissionName, description, ownerId);
    }

    /**
     * Unregister a name and strip it from every group that references it.
     *
     * @return false if the name was not registered
     */
    public boolean unregisterPermission(String permissionName) {
        String name = requirePermission(permissionName);
        if (registry.unregister(name).isEmpty()) {
            return false;
        }
        int groups = store.removePermissionFromAllGroups(name);
        log.info("Unregistered permission {} ({} group(s) updated)", name, groups);
        return true;
    }

    public PermissionRegistry registry() {
        return registry;
    }

    private static String requirePermission(String permissionName) {
        require(permissionName, "permission name");
        return PermissionNames.normalize(permissionName);
    }

    private static void require(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " required");
        }
    }
}
