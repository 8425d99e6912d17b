package com.streamwarden.app;

import com.streamwarden.app.commands.CommandContext;
import com.streamwarden.app.commands.CommandProcessor;
import com.streamwarden.app.commands.CommandResult;
import com.streamwarden.app.commands.ModerationCommands;
import com.streamwarden.app.commands.PermissionCommands;
import com.streamwarden.app.commands.PermitCommand;
import com.streamwarden.app.plugin.PluginRegistry;
import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.moderation.ChatModerator;
import com.streamwarden.moderation.ModerationEngine;
import com.streamwarden.moderation.ModerationLog;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.policy.InMemoryModerationPolicyStore;
import com.streamwarden.moderation.state.LinkPermits;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.NoticeThrottle;
import com.streamwarden.moderation.state.WarningStateTracker;
import com.streamwarden.permission.PermissionResolver;
import com.streamwarden.permission.PermissionService;
import com.streamwarden.permission.actor.InMemoryActorDirectory;
import com.streamwarden.permission.registry.ConcurrentPermissionRegistry;
import com.streamwarden.permission.store.InMemoryPermissionStore;

import java.time.Duration;
import java.time.Instant;

/**
 * The application wired by hand over in-memory stores, with the built-in
 * command plugins loaded.
 */
public class WardenFixture {

    public static final String CHANNEL = "1000";
    public static final String PREFIX = "!";

    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));

    public final InMemoryPermissionStore permissionStore = new InMemoryPermissionStore();
    public final InMemoryActorDirectory actors = new InMemoryActorDirectory();
    public final ConcurrentPermissionRegistry permissionRegistry = new ConcurrentPermissionRegistry();
    public final PermissionResolver resolver = new PermissionResolver(permissionStore, actors);
    public final PermissionService permissionService = new PermissionService(permissionStore, actors,
            permissionRegistry);

    public final InMemoryModerationPolicyStore policyStore = new InMemoryModerationPolicyStore();
    public final CompiledPolicyCache policies = new CompiledPolicyCache(policyStore, Duration.ofDays(1),
            Duration.ofMinutes(10));
    public final WarningStateTracker warnings = new WarningStateTracker();
    public final MessageCache messageCache = new MessageCache(1_000);
    public final LinkPermits permits = new LinkPermits();
    public final ModerationLog moderationLog = new ModerationLog(50);
    public final ModerationEngine engine = new ModerationEngine(policies, resolver, warnings, messageCache, permits,
            clock);
    public final ChatModerator moderator = new ChatModerator(engine, policies, messageCache, new NoticeThrottle(),
            moderationLog, clock);

    public final CommandProcessor commandProcessor = new CommandProcessor(resolver);
    public final PluginRegistry plugins = new PluginRegistry(commandProcessor, permissionService);

    public WardenFixture loadBuiltInCommands() {
        plugins.load(new PermissionCommands(permissionService));
        plugins.load(new ModerationCommands(policyStore, policies, moderationLog, messageCache, warnings));
        plugins.load(new PermitCommand(permits, policies, clock));
        return this;
    }

    public Actor user(String userId, UserLevel level) {
        return actors.observe(CHANNEL, userId, UserLevels.of(level));
    }

    /** Run a command as the given user, re-reading the actor so memberships are current. */
    public CommandResult run(String userId, String text) {
        Actor actor = actors.find(CHANNEL, userId).orElse(Actor.viewer(userId));
        return commandProcessor.handleCommand(text, new CommandContext(CHANNEL, actor, "user" + userId, PREFIX));
    }
}
