package com.streamwarden.app.commands;

import com.streamwarden.app.plugin.PluginApi;
import com.streamwarden.app.plugin.WardenPlugin;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.moderation.ModerationLog;
import com.streamwarden.moderation.policy.ChannelModerationSettings;
import com.streamwarden.moderation.policy.CompiledChannel;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.FilterPolicy;
import com.streamwarden.moderation.policy.ModerationDefaults;
import com.streamwarden.moderation.policy.ModerationPolicyStore;
import com.streamwarden.moderation.policy.PunishmentSpec;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.WarningStateTracker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Chat-side management of the moderation filters: {@code !moderation
 * enable|disable|status|recent|whosaid|pardon|allowlist}.
 */
@Component
public class ModerationCommands implements WardenPlugin {

    static final String COMMAND = "moderation";
    private static final int MAX_RECENT = 10;

    private final ModerationPolicyStore store;
    private final CompiledPolicyCache policies;
    private final ModerationLog moderationLog;
    private final MessageCache messageCache;
    private final WarningStateTracker warnings;

    public ModerationCommands(ModerationPolicyStore store, CompiledPolicyCache policies,
            ModerationLog moderationLog, MessageCache messageCache, WarningStateTracker warnings) {
        this.store = store;
        this.policies = policies;
        this.moderationLog = moderationLog;
        this.messageCache = messageCache;
        this.warnings = warnings;
    }

    @Override
    public String getId() {
        return "moderation";
    }

    @Override
    public String getName() {
        return "Chat moderation";
    }

    @Override
    public void register(PluginApi api) {
        for (String sub : List.of("enable", "disable", "status", "recent", "whosaid", "pardon", "allowlist")) {
            api.registerPermission("can_moderation_" + sub, "Use " + COMMAND + " " + sub);
        }
        api.registerCommand(COMMAND, UserLevels.of(UserLevel.MODERATOR), 1,
                "Manage the moderation filters", this::handle);
    }

    CommandResult handle(CommandArgs args, CommandContext ctx) {
        return switch (args.keyword(0, "usage")) {
            case "enable" -> setEnabled(args, ctx, true);
            case "disable" -> setEnabled(args, ctx, false);
            case "status" -> status(ctx);
            case "recent" -> recent(args, ctx);
            case "whosaid" -> whoSaid(args, ctx);
            case "pardon" -> pardon(args, ctx);
            case "allowlist" -> allowlist(args, ctx);
            default -> CommandResult.format(
                    "%s, manages the moderation filters. Usage: %s%s [enable, disable, status, recent, whosaid, pardon, allowlist]",
                    ctx.mention(), ctx.commandPrefix(), COMMAND);
        };
    }

    private CommandResult setEnabled(CommandArgs args, CommandContext ctx, boolean enabled) {
        String filterName = args.rest(1);
        if (filterName == null) {
            return usage(ctx, (enabled ? "enable" : "disable") + " (" + filterNames() + ")");
        }
        FilterKind kind;
        try {
            kind = FilterKind.parse(filterName);
        } catch (IllegalArgumentException e) {
            return CommandResult.format("%s, unknown filter %s. Filters: %s", ctx.mention(), filterName,
                    filterNames());
        }

        store.update(ctx.channelId(), settings -> {
            FilterPolicy policy = settings.policy(kind).orElseGet(() -> ModerationDefaults.policy(kind));
            policy.setEnabled(enabled);
            settings.putPolicy(kind, policy);
            return settings;
        });

        if (!enabled) {
            return CommandResult.format("%s, the %s filter has been disabled.", ctx.mention(), kind.id());
        }
        List<String> problems = policies.channel(ctx.channelId()).problems().get(kind);
        if (problems != null && !problems.isEmpty()) {
            return CommandResult.format("%s, the %s filter is enabled but inactive until its settings are fixed: %s",
                    ctx.mention(), kind.id(), String.join("; ", problems));
        }
        return CommandResult.format("%s, the %s filter has been enabled.", ctx.mention(), kind.id());
    }

    private CommandResult status(CommandContext ctx) {
        CompiledChannel channel = policies.channel(ctx.channelId());
        List<String> active = channel.filters().keySet().stream().map(FilterKind::id).toList();
        StringBuilder sb = new StringBuilder(ctx.mention()).append(", ");
        if (active.isEmpty()) {
            sb.append("no filters are active.");
        } else {
            sb.append("active filters: ").append(String.join(", ", active)).append('.');
        }
        if (!channel.problems().isEmpty()) {
            sb.append(" Misconfigured: ").append(channel.problems().keySet().stream()
                    .map(FilterKind::id)
                    .collect(Collectors.joining(", "))).append('.');
        }
        return CommandResult.text(sb.toString());
    }

    private CommandResult recent(CommandArgs args, CommandContext ctx) {
        Integer requested = CommandUtils.parsePositive(args.get(1));
        int limit = Math.min(MAX_RECENT, requested != null ? requested : 5);
        List<ModerationLog.Entry> entries = moderationLog.recent(ctx.channelId(), limit);
        if (entries.isEmpty()) {
            return CommandResult.format("%s, nobody has been punished recently.", ctx.mention());
        }
        List<String> lines = new ArrayList<>();
        for (ModerationLog.Entry entry : entries) {
            lines.add(String.format("%s: %s (%s)", entry.userLogin() != null ? entry.userLogin() : entry.userId(),
                    entry.rule(), describe(entry.punishment())));
        }
        return CommandResult.format("%s, recent punishments: %s", ctx.mention(), String.join(" | ", lines));
    }

    private CommandResult whoSaid(CommandArgs args, CommandContext ctx) {
        String regex = args.rest(1);
        if (regex == null) {
            return usage(ctx, "whosaid (Pattern)");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            return CommandResult.format("%s, invalid pattern: %s", ctx.mention(), e.getDescription());
        }
        List<String> users = messageCache.usersWhoSent(ctx.channelId(), pattern);
        if (users.isEmpty()) {
            return CommandResult.format("%s, no recent message matches.", ctx.mention());
        }
        return CommandResult.format("%s, sent by: %s", ctx.mention(), String.join(", ", users));
    }

    private CommandResult pardon(CommandArgs args, CommandContext ctx) {
        String userId = args.get(1);
        if (userId == null) {
            return usage(ctx, "pardon (UserId)");
        }
        if (!warnings.clear(ctx.channelId(), userId)) {
            return CommandResult.format("%s, user %s has no active warning.", ctx.mention(), userId);
        }
        return CommandResult.format("%s, the warning of user %s has been cleared.", ctx.mention(), userId);
    }

    private CommandResult allowlist(CommandArgs args, CommandContext ctx) {
        String action = args.keyword(1, "usage");
        String entry = args.get(2);
        if (!action.equals("add") && !action.equals("remove") || entry == null) {
            return usage(ctx, "allowlist [add, remove] (Domain)");
        }
        String normalized = entry.toLowerCase(Locale.ROOT);
        AtomicBoolean changed = new AtomicBoolean();
        store.update(ctx.channelId(), settings -> {
            FilterPolicy links = linksPolicy(settings);
            List<String> allowlist = new ArrayList<>(links.allowlistOrEmpty());
            if (action.equals("add")) {
                changed.set(!allowlist.contains(normalized) && allowlist.add(normalized));
            } else {
                changed.set(allowlist.remove(normalized));
            }
            links.setAllowlist(allowlist);
            return settings;
        });
        if (!changed.get()) {
            return CommandResult.format("%s, %s was %s on the link allowlist.", ctx.mention(), normalized,
                    action.equals("add") ? "already" : "not");
        }
        return CommandResult.format("%s, %s has been %s the link allowlist.", ctx.mention(), normalized,
                action.equals("add") ? "added to" : "removed from");
    }

    private static FilterPolicy linksPolicy(ChannelModerationSettings settings) {
        FilterPolicy links = settings.policy(FilterKind.LINKS).orElseGet(() -> ModerationDefaults.policy(FilterKind.LINKS));
        settings.putPolicy(FilterKind.LINKS, links);
        return links;
    }

    private CommandResult usage(CommandContext ctx, String usage) {
        return CommandResult.format("%s, usage: %s%s %s", ctx.mention(), ctx.commandPrefix(), COMMAND, usage);
    }

    private static String filterNames() {
        return Arrays.stream(FilterKind.values()).map(FilterKind::id).collect(Collectors.joining(", "));
    }

    static String describe(PunishmentSpec punishment) {
        return switch (punishment.kind()) {
            case TIMEOUT -> "timeout " + punishment.durationSeconds() + "s";
            default -> punishment.kind().name().toLowerCase(Locale.ROOT);
        };
    }
}
