package com.streamwarden.app.commands;

import com.streamwarden.app.plugin.PluginApi;
import com.streamwarden.app.plugin.WardenPlugin;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.state.LinkPermits;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * {@code !permit (UserId) [seconds]}: let one user post links for a while.
 */
@Component
public class PermitCommand implements WardenPlugin {

    static final String COMMAND = "permit";
    static final int DEFAULT_PERMIT_SECONDS = 60;

    private final LinkPermits permits;
    private final CompiledPolicyCache policies;
    private final Clock clock;

    public PermitCommand(LinkPermits permits, CompiledPolicyCache policies, Clock clock) {
        this.permits = permits;
        this.policies = policies;
        this.clock = clock;
    }

    @Override
    public String getId() {
        return "permit";
    }

    @Override
    public String getName() {
        return "Link permits";
    }

    @Override
    public void register(PluginApi api) {
        api.registerPermission("can_permit", "Allow a user to post links for a while");
        api.registerCommand(COMMAND, UserLevels.of(UserLevel.MODERATOR), 0,
                "Allow a user to post links for a while", this::handle);
    }

    CommandResult handle(CommandArgs args, CommandContext ctx) {
        String userId = args.get(0);
        if (userId == null) {
            return CommandResult.format("%s, usage: %s%s (UserId) [seconds]", ctx.mention(), ctx.commandPrefix(),
                    COMMAND);
        }
        Integer requested = CommandUtils.parsePositive(args.get(1));
        int seconds = requested != null ? requested : configuredSeconds(ctx.channelId());
        permits.grant(ctx.channelId(), userId, Duration.ofSeconds(seconds), clock.instant());
        return CommandResult.format("%s, user %s may post links for the next %d seconds.", ctx.mention(), userId,
                seconds);
    }

    private int configuredSeconds(String channelId) {
        return policies.filter(channelId, FilterKind.LINKS)
                .map(compiled -> compiled.policy().getPermitSeconds())
                .filter(seconds -> seconds != null && seconds > 0)
                .orElse(DEFAULT_PERMIT_SECONDS);
    }
}
