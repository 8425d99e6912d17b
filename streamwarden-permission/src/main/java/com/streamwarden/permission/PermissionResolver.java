package com.streamwarden.permission;

import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.GlobalStanding;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.common.logging.SubsystemLogger;
import com.streamwarden.permission.actor.ActorDirectory;
import com.streamwarden.permission.store.PermissionStore;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether an actor may perform an action.
 * <p>
 * Rules, first match wins:
 * <ol>
 * <li>unknown actor: allowed only if the requirement includes {@code VIEWER}</li>
 * <li>{@code BANNED}: denied</li>
 * <li>{@code SUPER_ADMIN}, a broadcaster, or a {@code VIEWER} requirement: allowed</li>
 * <li>any held ranked level at or above the requirement's rank threshold, or
 * any held flag the requirement names: allowed</li>
 * <li>{@code CUSTOM} requirement with a permission name: the group entries
 * decide, with an explicit deny in any group winning over an allow</li>
 * <li>otherwise denied</li>
 * </ol>
 * Stateless apart from read-only lookups, safe to call from any thread.
 */
public class PermissionResolver {

    private static final SubsystemLogger log = SubsystemLogger.create("permission/resolver");

    private final PermissionStore store;
    private final ActorDirectory actors;

    public PermissionResolver(PermissionStore store, ActorDirectory actors) {
        this.store = store;
        this.actors = actors;
    }

    public boolean canAct(Actor actor, UserLevels required, String permissionName) {
        return evaluate(actor, required, permissionName).allowed();
    }

    public boolean canAct(Actor actor, UserLevels required) {
        return canAct(actor, required, null);
    }

    /**
     * Look the actor up in the directory, then {@link #canAct(Actor, UserLevels, String)}.
     */
    public boolean canAct(String channelId, String userId, UserLevels required, String permissionName) {
        Actor actor = actors.find(channelId, userId).orElse(null);
        return canAct(actor, required, permissionName);
    }

    public PermissionDecision evaluate(Actor actor, UserLevels required, String permissionName) {
        UserLevels requirement = required != null ? required : UserLevels.none();

        if (actor == null) {
            return requirement.has(UserLevel.VIEWER)
                    ? PermissionDecision.allow("viewer")
                    : PermissionDecision.deny("unknown user");
        }
        if (actor.globalStanding() == GlobalStanding.BANNED) {
            return PermissionDecision.deny("banned");
        }
        if (actor.globalStanding() == GlobalStanding.SUPER_ADMIN) {
            return PermissionDecision.allow("super admin");
        }
        if (actor.levelInChannel().has(UserLevel.BROADCASTER)) {
            return PermissionDecision.allow("broadcaster");
        }
        if (requirement.has(UserLevel.VIEWER)) {
            return PermissionDecision.allow("viewer");
        }

        for (UserLevel held : actor.levelInChannel().asSet()) {
            if (UserLevels.satisfiesRank(held, requirement)) {
                return PermissionDecision.allow("rank " + held);
            }
            if (UserLevels.hasFlag(held, requirement)) {
                return PermissionDecision.allow("flag " + held);
            }
        }

        if (requirement.has(UserLevel.CUSTOM) && !PermissionNames.isBlank(permissionName)) {
            return hasCustomPermission(actor.groupMemberships(), permissionName)
                    ? PermissionDecision.allow("group permission " + PermissionNames.normalize(permissionName))
                    : PermissionDecision.deny("no group permission " + PermissionNames.normalize(permissionName));
        }
        return PermissionDecision.deny("level " + actor.levelInChannel() + " does not satisfy " + requirement);
    }

    /**
     * Whether the groups grant the permission. A group id that no longer
     * resolves is skipped.
     */
    public boolean hasCustomPermission(Set<String> groupIds, String permissionName) {
        if (groupIds == null || groupIds.isEmpty() || PermissionNames.isBlank(permissionName)) {
            return false;
        }
        String name = PermissionNames.normalize(permissionName);
        boolean allowed = false;
        boolean denied = false;
        for (String groupId : groupIds) {
            Optional<PermissionGroup> group = store.findById(groupId);
            if (group.isEmpty()) {
                log.debug("Skipping dangling group reference", Map.of("groupId", groupId));
                continue;
            }
            allowed |= group.get().allows(name);
            denied |= group.get().denies(name);
        }
        return allowed && !denied;
    }
}
