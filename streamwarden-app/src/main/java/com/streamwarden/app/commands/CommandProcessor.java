package com.streamwarden.app.commands;

import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.permission.CommandPermissions;
import com.streamwarden.permission.PermissionResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel-agnostic chat command dispatcher. Commands are registered by
 * plugins and every invocation is gated by
 * {@code canAct(actor, defaultLevel | CUSTOM, can_<command>[_<arg>...])}.
 */
@Slf4j
@Component
public class CommandProcessor {

    private final Map<String, RegisteredCommand> commands = new ConcurrentHashMap<>();
    private final PermissionResolver resolver;

    public CommandProcessor(PermissionResolver resolver) {
        this.resolver = resolver;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * @return false if another command already uses the name
     */
    public boolean register(RegisteredCommand command) {
        String key = command.name().toLowerCase(Locale.ROOT);
        RegisteredCommand existing = commands.putIfAbsent(key, command);
        if (existing != null) {
            log.warn("Command {} already registered by {}, ignoring registration from {}",
                    key, existing.ownerId(), command.ownerId());
            return false;
        }
        log.debug("Registered command {} (owner={}, default={})", key, command.ownerId(), command.defaultLevel());
        return true;
    }

    public boolean unregister(String name) {
        return name != null && commands.remove(name.toLowerCase(Locale.ROOT)) != null;
    }

    /**
     * @return number of commands removed
     */
    public int unregisterOwnedBy(String ownerId) {
        List<String> owned = commands.values().stream()
                .filter(c -> c.ownerId().equals(ownerId))
                .map(RegisteredCommand::name)
                .toList();
        int removed = 0;
        for (String name : owned) {
            if (unregister(name)) {
                removed++;
            }
        }
        return removed;
    }

    public Optional<RegisteredCommand> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(commands.get(name.toLowerCase(Locale.ROOT)));
    }

    public List<RegisteredCommand> list() {
        List<RegisteredCommand> all = new ArrayList<>(commands.values());
        all.sort((a, b) -> a.name().compareToIgnoreCase(b.name()));
        return all;
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    /**
     * Handle a chat command.
     *
     * @param text the full message text (e.g. "!permissions group create VIPs")
     * @param ctx  the invocation context; its prefix decides what counts as a
     *             command
     * @return the reply, or null if the text is not a known command
     */
    public CommandResult handleCommand(String text, CommandContext ctx) {
        if (text == null || text.isBlank() || ctx == null) {
            return null;
        }
        String prefix = ctx.commandPrefix();
        String trimmed = text.trim();
        if (prefix == null || prefix.isEmpty() || !trimmed.startsWith(prefix)) {
            return null;
        }

        String withoutPrefix = trimmed.substring(prefix.length());
        int spaceIdx = withoutPrefix.indexOf(' ');
        String name = (spaceIdx < 0 ? withoutPrefix : withoutPrefix.substring(0, spaceIdx)).toLowerCase(Locale.ROOT);
        CommandArgs args = CommandArgs.parse(spaceIdx < 0 ? "" : withoutPrefix.substring(spaceIdx + 1));
        if (name.isEmpty()) {
            return null;
        }

        RegisteredCommand command = commands.get(name);
        if (command == null) {
            log.debug("Unknown command: {}{}", prefix, name);
            return null;
        }

        String permissionName = CommandPermissions.permissionNameFor(name, args.words(), command.argDepth());
        UserLevels required = command.defaultLevel().with(UserLevel.CUSTOM);
        if (!resolver.canAct(ctx.actor(), required, permissionName)) {
            log.info("User {} denied {}{} in channel {} ({})",
                    ctx.actor() != null ? ctx.actor().userId() : ctx.senderLogin(), prefix, name,
                    ctx.channelId(), permissionName);
            return CommandResult.format("%s, you do not have permission to use %s%s.", ctx.mention(), prefix, name);
        }

        try {
            return command.handler().handle(args, ctx);
        } catch (IllegalArgumentException e) {
            return CommandResult.format("%s, %s", ctx.mention(), e.getMessage());
        } catch (Exception e) {
            log.error("Command {}{} failed: {}", prefix, name, e.getMessage(), e);
            return CommandResult.format("%s, the command failed: %s", ctx.mention(), e.getMessage());
        }
    }
}
