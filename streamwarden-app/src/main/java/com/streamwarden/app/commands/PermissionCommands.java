package com.streamwarden.app.commands;

import com.streamwarden.app.plugin.PluginApi;
import com.streamwarden.app.plugin.WardenPlugin;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.permission.PermissionEntry;
import com.streamwarden.permission.PermissionGroup;
import com.streamwarden.permission.PermissionService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Permission group management: {@code !permissions group ...} and
 * {@code !permissions user ...}. Broadcaster only unless granted through
 * {@code can_permissions_group} / {@code can_permissions_user}.
 */
@Component
public class PermissionCommands implements WardenPlugin {

    static final String COMMAND = "permissions";

    private final PermissionService permissions;

    public PermissionCommands(PermissionService permissions) {
        this.permissions = permissions;
    }

    @Override
    public String getId() {
        return "permissions";
    }

    @Override
    public String getName() {
        return "Permission groups";
    }

    @Override
    public void register(PluginApi api) {
        api.registerPermission("can_permissions", "Show permission command usage");
        api.registerPermission("can_permissions_group", "Create, delete and edit permission groups");
        api.registerPermission("can_permissions_user", "Add users to and remove them from permission groups");
        api.registerCommand(COMMAND, UserLevels.of(UserLevel.BROADCASTER), 1,
                "Manage custom permission groups", this::handle);
    }

    CommandResult handle(CommandArgs args, CommandContext ctx) {
        return switch (args.keyword(0, "usage")) {
            case "group" -> handleGroup(args, ctx);
            case "user" -> handleUser(args, ctx);
            default -> CommandResult.format("%s, manages custom permissions. Usage: %s%s [group, user]",
                    ctx.mention(), ctx.commandPrefix(), COMMAND);
        };
    }

    // =========================================================================
    // !permissions group
    // =========================================================================

    private CommandResult handleGroup(CommandArgs args, CommandContext ctx) {
        return switch (args.keyword(1, "usage")) {
            case "create" -> createGroup(args, ctx);
            case "delete", "remove" -> deleteGroup(args, ctx);
            case "list" -> listGroups(args, ctx);
            case "allow" -> setEntry(args, ctx, false);
            case "deny" -> setEntry(args, ctx, true);
            case "inherit" -> inherit(args, ctx);
            case "listpermissions", "permissions" -> listPermissions(args, ctx);
            default -> usage(ctx, "group [create, delete, list, allow, deny, inherit, listpermissions]");
        };
    }

    private CommandResult createGroup(CommandArgs args, CommandContext ctx) {
        String groupName = args.rest(2);
        if (groupName == null) {
            return usage(ctx, "group create (GroupName)");
        }
        if (permissions.findGroup(ctx.channelId(), groupName).isPresent()) {
            return CommandResult.format("%s, the permission group %s already exists.", ctx.mention(), groupName);
        }
        PermissionGroup group = permissions.createGroup(ctx.channelId(), groupName);
        return CommandResult.format("%s, the permission group %s has been created.", ctx.mention(), group.name());
    }

    private CommandResult deleteGroup(CommandArgs args, CommandContext ctx) {
        String groupName = args.rest(2);
        if (groupName == null) {
            return usage(ctx, "group delete (GroupName)");
        }
        if (!permissions.deleteGroup(ctx.channelId(), groupName)) {
            return noSuchGroup(ctx, groupName);
        }
        return CommandResult.format("%s, the permission group %s has been deleted.", ctx.mention(), groupName);
    }

    private CommandResult listGroups(CommandArgs args, CommandContext ctx) {
        List<String> names = permissions.listGroups(ctx.channelId()).stream()
                .map(PermissionGroup::name)
                .sorted(String.CASE_INSENSITIVE_ORDER)
                .toList();
        if (names.isEmpty()) {
            return CommandResult.format("%s, this channel has no permission groups.", ctx.mention());
        }
        Integer requested = CommandUtils.parsePositive(args.get(2));
        int page = CommandUtils.clampPage(requested != null ? requested : 1, names.size());
        return CommandResult.format("%s, permission groups [page %d of %d]: %s", ctx.mention(), page,
                CommandUtils.pageCount(names.size()), String.join(", ", CommandUtils.page(names, page)));
    }

    private CommandResult setEntry(CommandArgs args, CommandContext ctx, boolean denied) {
        String permissionName = args.get(2);
        String groupName = args.rest(3);
        if (permissionName == null || groupName == null) {
            return usage(ctx, "group " + (denied ? "deny" : "allow") + " (PermissionName) (GroupName)");
        }
        if (!permissions.updatePermission(ctx.channelId(), groupName, permissionName, denied)) {
            return noSuchGroup(ctx, groupName);
        }
        return denied
                ? CommandResult.format("%s, the permission %s has been explicitly denied to members of %s.",
                        ctx.mention(), permissionName, groupName)
                : CommandResult.format("%s, the permission %s has been allowed to members of %s.",
                        ctx.mention(), permissionName, groupName);
    }

    private CommandResult inherit(CommandArgs args, CommandContext ctx) {
        String permissionName = args.get(2);
        String groupName = args.rest(3);
        if (permissionName == null || groupName == null) {
            return usage(ctx, "group inherit (PermissionName) (GroupName)");
        }
        if (!permissions.removePermission(ctx.channelId(), groupName, permissionName)) {
            return noSuchGroup(ctx, groupName);
        }
        return CommandResult.format("%s, members of %s now inherit the permission %s.",
                ctx.mention(), groupName, permissionName);
    }

    private CommandResult listPermissions(CommandArgs args, CommandContext ctx) {
        Integer requested = CommandUtils.parsePositive(args.get(2));
        String groupName = args.rest(requested != null ? 3 : 2);
        if (groupName == null) {
            return usage(ctx, "group listpermissions [page] (GroupName)");
        }
        Optional<PermissionGroup> group = permissions.findGroup(ctx.channelId(), groupName);
        if (group.isEmpty()) {
            return noSuchGroup(ctx, groupName);
        }
        List<PermissionEntry> entries = group.get().entries();
        if (entries.isEmpty()) {
            return CommandResult.format("%s, the group %s has no permissions set.", ctx.mention(), group.get().name());
        }
        int page = CommandUtils.clampPage(requested != null ? requested : 1, entries.size());
        String listed = CommandUtils.page(entries, page).stream()
                .map(e -> e.denied() ? e.permissionName() + " (Denied)" : e.permissionName())
                .collect(Collectors.joining(", "));
        return CommandResult.format("%s, permissions of group %s [page %d of %d]: %s", ctx.mention(),
                group.get().name(), page, CommandUtils.pageCount(entries.size()), listed);
    }

    // =========================================================================
    // !permissions user
    // =========================================================================

    private CommandResult handleUser(CommandArgs args, CommandContext ctx) {
        String action = args.keyword(1, "usage");
        String userId = args.get(2);
        String groupName = args.rest(3);
        if (!action.equals("add") && !action.equals("remove") || userId == null || groupName == null) {
            return usage(ctx, "user [add, remove] (UserId) (GroupName)");
        }
        if (action.equals("add")) {
            if (!permissions.addMembership(ctx.channelId(), userId, groupName)) {
                return noSuchGroup(ctx, groupName);
            }
            return CommandResult.format("%s, user %s has been added to %s.", ctx.mention(), userId, groupName);
        }
        if (permissions.findGroup(ctx.channelId(), groupName).isEmpty()) {
            return noSuchGroup(ctx, groupName);
        }
        if (!permissions.removeMembership(ctx.channelId(), userId, groupName)) {
            return CommandResult.format("%s, user %s is not a member of %s.", ctx.mention(), userId, groupName);
        }
        return CommandResult.format("%s, user %s has been removed from %s.", ctx.mention(), userId, groupName);
    }

    private CommandResult usage(CommandContext ctx, String usage) {
        return CommandResult.format("%s, usage: %s%s %s", ctx.mention(), ctx.commandPrefix(), COMMAND, usage);
    }

    private static CommandResult noSuchGroup(CommandContext ctx, String groupName) {
        return CommandResult.format("%s, there is no permission group named %s.", ctx.mention(), groupName);
    }
}
