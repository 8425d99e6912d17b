package com.streamwarden.moderation;

import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import com.streamwarden.common.logging.SubsystemLogger;
import com.streamwarden.moderation.filter.ActionMessageFilter;
import com.streamwarden.moderation.filter.BlacklistMatcher;
import com.streamwarden.moderation.filter.CapsFilter;
import com.streamwarden.moderation.filter.EmotesFilter;
import com.streamwarden.moderation.filter.FakePurgeFilter;
import com.streamwarden.moderation.filter.FilterContext;
import com.streamwarden.moderation.filter.LengthyMessageFilter;
import com.streamwarden.moderation.filter.LinksFilter;
import com.streamwarden.moderation.filter.MessageFilter;
import com.streamwarden.moderation.filter.OneManSpamFilter;
import com.streamwarden.moderation.filter.RepetitionFilter;
import com.streamwarden.moderation.filter.SymbolsFilter;
import com.streamwarden.moderation.filter.ZalgoFilter;
import com.streamwarden.moderation.policy.CompiledBlacklistEntry;
import com.streamwarden.moderation.policy.CompiledChannel;
import com.streamwarden.moderation.policy.CompiledPolicy;
import com.streamwarden.moderation.policy.CompiledPolicyCache;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.state.LinkPermits;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.WarningStateTracker;
import com.streamwarden.moderation.text.MessageText;
import com.streamwarden.permission.PermissionResolver;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a filter punishes a message.
 * <p>
 * Per filter: skip when the filter is not enabled (or its policy is missing or
 * malformed), skip exempt actors, test the trigger, then pick the warning or
 * repeat tier from the author's warning state. A first offense records a
 * warning; a repeat inside the window does not move it.
 */
public class ModerationEngine {

    private static final SubsystemLogger log = SubsystemLogger.create("moderation/engine");

    /** Always exempt, on top of the per-filter excluded levels. */
    static final UserLevels ALWAYS_EXEMPT = UserLevels.of(UserLevel.BROADCASTER, UserLevel.MODERATOR);

    private final CompiledPolicyCache policies;
    private final PermissionResolver resolver;
    private final WarningStateTracker warnings;
    private final Clock clock;
    private final Map<FilterKind, MessageFilter> filters = new EnumMap<>(FilterKind.class);

    public ModerationEngine(CompiledPolicyCache policies, PermissionResolver resolver, WarningStateTracker warnings,
            MessageCache messageCache, LinkPermits permits, Clock clock) {
        this.policies = policies;
        this.resolver = resolver;
        this.warnings = warnings;
        this.clock = clock;
        register(new CapsFilter());
        register(new SymbolsFilter());
        register(new ZalgoFilter());
        register(new LinksFilter(permits));
        register(new LengthyMessageFilter());
        register(new RepetitionFilter());
        register(new EmotesFilter());
        register(new FakePurgeFilter());
        register(new ActionMessageFilter());
        register(new OneManSpamFilter(messageCache));
    }

    private void register(MessageFilter filter) {
        filters.put(filter.kind(), filter);
    }

    // =========================================================================
    // Single filter
    // =========================================================================

    /**
     * Evaluate one filter kind against a message.
     */
    public Optional<ModerationDecision> evaluate(FilterKind kind, ChatMessage message, Actor actor) {
        Instant now = clock.instant();
        CompiledChannel channel = policies.channel(message.channelId());
        MessageText text = MessageText.of(message.text(), message.emotes());
        return check(kind, channel, message, text, actor, now)
                .map(hit -> hit.fixed() != null ? hit.fixed() : tiered(hit.policy(), message, now));
    }

    // =========================================================================
    // All filters
    // =========================================================================

    /**
     * Evaluate every filter against a message. All tiered filters that fire
     * share one escalation step, so a message tripping two filters is still a
     * first offense.
     *
     * @return one decision per firing filter
     */
    public List<ModerationDecision> evaluateAll(ChatMessage message, Actor actor) {
        Instant now = clock.instant();
        CompiledChannel channel = policies.channel(message.channelId());
        if (channel.filters().isEmpty()) {
            return List.of();
        }
        MessageText text = MessageText.of(message.text(), message.emotes());

        List<ModerationDecision> decisions = new ArrayList<>();
        List<CompiledPolicy> tieredHits = new ArrayList<>();
        for (FilterKind kind : FilterKind.values()) {
            Optional<Hit> hit = check(kind, channel, message, text, actor, now);
            if (hit.isEmpty()) {
                continue;
            }
            if (hit.get().fixed() != null) {
                decisions.add(hit.get().fixed());
            } else {
                tieredHits.add(hit.get().policy());
            }
        }
        if (!tieredHits.isEmpty()) {
            Duration window = tieredHits.stream()
                    .map(CompiledPolicy::warningWindow)
                    .max(Duration::compareTo)
                    .orElseThrow();
            WarningStateTracker.Tier tier = warnings.escalate(message.channelId(), message.userId(), window, now);
            for (CompiledPolicy policy : tieredHits) {
                decisions.add(decisionFor(policy, tier));
            }
        }
        return decisions;
    }

    // =========================================================================
    // Internals
    // =========================================================================

    /** A fired filter: either a fixed blacklist decision or a policy to tier. */
    private record Hit(CompiledPolicy policy, ModerationDecision fixed) {
    }

    private Optional<Hit> check(FilterKind kind, CompiledChannel channel, ChatMessage message, MessageText text,
            Actor actor, Instant now) {
        Optional<CompiledPolicy> compiled = channel.filter(kind);
        if (compiled.isEmpty()) {
            return Optional.empty();
        }
        CompiledPolicy policy = compiled.get();
        if (isExempt(actor, policy)) {
            return Optional.empty();
        }
        try {
            if (kind == FilterKind.BLACKLIST) {
                return BlacklistMatcher.firstMatch(policy.blacklist(), message)
                        .map(entry -> new Hit(policy, blacklistDecision(entry)));
            }
            MessageFilter filter = filters.get(kind);
            if (filter != null && filter.triggers(new FilterContext(message, text, policy, actor, now))) {
                return Optional.of(new Hit(policy, null));
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.forChannel(message.channelId()).error("Filter failed, not punishing",
                    Map.of("filter", kind.id(), "user", message.userId()), e);
            return Optional.empty();
        }
    }

    private boolean isExempt(Actor actor, CompiledPolicy policy) {
        UserLevels exempt = ALWAYS_EXEMPT.union(policy.policy().getExcludedLevels());
        return resolver.canAct(actor, exempt);
    }

    private ModerationDecision tiered(CompiledPolicy policy, ChatMessage message, Instant now) {
        WarningStateTracker.Tier tier = warnings.escalate(message.channelId(), message.userId(),
                policy.warningWindow(), now);
        return decisionFor(policy, tier);
    }

    private static ModerationDecision decisionFor(CompiledPolicy policy, WarningStateTracker.Tier tier) {
        return tier == WarningStateTracker.Tier.REPEAT
                ? new ModerationDecision(policy.kind(), ModerationDecision.Tier.REPEAT,
                        policy.policy().getRepeatTier(), policy.kind().id())
                : new ModerationDecision(policy.kind(), ModerationDecision.Tier.WARNING,
                        policy.policy().getWarningTier(), policy.kind().id());
    }

    private static ModerationDecision blacklistDecision(CompiledBlacklistEntry entry) {
        return new ModerationDecision(FilterKind.BLACKLIST, ModerationDecision.Tier.FIXED,
                entry.entry().punishment(), entry.entry().label());
    }
}
