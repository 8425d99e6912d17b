package com.streamwarden.moderation.policy;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.streamwarden.common.logging.SubsystemLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiles channel documents into {@link CompiledChannel}s and keeps them until
 * the channel's document is saved again. Patterns and allowlists are built
 * here once instead of per message.
 */
public class CompiledPolicyCache {

    private static final SubsystemLogger log = SubsystemLogger.create("moderation/policy");

    private final ModerationPolicyStore store;
    private final Duration defaultWarningWindow;
    private final LoadingCache<String, CompiledChannel> cache;

    /**
     * @param maxAge upper bound on how long a compiled document is trusted, so
     *               out-of-band edits to the backing store are picked up
     */
    public CompiledPolicyCache(ModerationPolicyStore store, Duration defaultWarningWindow, Duration maxAge) {
        this.store = store;
        this.defaultWarningWindow = defaultWarningWindow;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(maxAge)
                .maximumSize(10_000)
                .build(this::load);
        store.addChangeListener(this::invalidate);
    }

    public CompiledChannel channel(String channelId) {
        return cache.get(channelId);
    }

    public Optional<CompiledPolicy> filter(String channelId, FilterKind kind) {
        return channel(channelId).filter(kind);
    }

    public void invalidate(String channelId) {
        cache.invalidate(channelId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private CompiledChannel load(String channelId) {
        Optional<ChannelModerationSettings> document = store.find(channelId);
        if (document.isEmpty()) {
            return CompiledChannel.unconfigured(channelId);
        }
        return compile(document.get(), defaultWarningWindow);
    }

    /**
     * Compile a channel document. Disabled filters are dropped; enabled ones
     * with validation problems are dropped and reported.
     */
    public static CompiledChannel compile(ChannelModerationSettings settings, Duration defaultWarningWindow) {
        String channelId = settings.getChannelId();
        Duration channelWindow = settings.getWarningWindowSeconds() != null
                ? Duration.ofSeconds(settings.getWarningWindowSeconds())
                : defaultWarningWindow;

        Map<FilterKind, CompiledPolicy> filters = new EnumMap<>(FilterKind.class);
        Map<FilterKind, List<String>> problems = new EnumMap<>(FilterKind.class);
        for (FilterKind kind : FilterKind.values()) {
            FilterPolicy policy = settings.policy(kind).orElse(null);
            if (policy == null || !policy.isEnabled()) {
                continue;
            }
            List<String> issues = FilterPolicyValidator.validate(kind, policy);
            if (!issues.isEmpty()) {
                problems.put(kind, issues);
                log.forChannel(channelId).warn("Ignoring malformed filter policy",
                        Map.of("filter", kind.id(), "problems", issues));
                continue;
            }
            Duration window = policy.getWarningWindowSeconds() != null
                    ? Duration.ofSeconds(policy.getWarningWindowSeconds())
                    : channelWindow;
            filters.put(kind, new CompiledPolicy(kind, policy, window,
                    compileBlacklist(kind, policy),
                    kind == FilterKind.LINKS
                            ? LinkAllowlist.of(policy.allowlistOrEmpty(), policy.isAllowClips())
                            : LinkAllowlist.empty()));
        }
        return new CompiledChannel(channelId,
                Collections.unmodifiableMap(filters),
                Duration.ofSeconds(Math.max(0, settings.getNoticeCooldownSeconds())),
                Collections.unmodifiableMap(problems));
    }

    private static List<CompiledBlacklistEntry> compileBlacklist(FilterKind kind, FilterPolicy policy) {
        if (kind != FilterKind.BLACKLIST) {
            return List.of();
        }
        List<CompiledBlacklistEntry> compiled = new ArrayList<>();
        for (BlacklistEntry entry : policy.blacklistOrEmpty()) {
            compiled.add(CompiledBlacklistEntry.compile(entry));
        }
        return List.copyOf(compiled);
    }
}
