package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moderation document of one channel.
 * <p>
 * Filters are keyed by {@link FilterKind#id()} in JSON; use
 * {@link #policy(FilterKind)} and {@link #putPolicy} rather than the raw map.
 */
@Data
public class ChannelModerationSettings {

    public static final int DEFAULT_WARNING_WINDOW_SECONDS = 86_400;
    public static final int DEFAULT_NOTICE_COOLDOWN_SECONDS = 30;

    private String channelId;

    /** How long a warning counts towards escalation. Null uses the bot-wide default. */
    private Integer warningWindowSeconds;

    /** Minimum gap between two moderation notices in chat. */
    private int noticeCooldownSeconds = DEFAULT_NOTICE_COOLDOWN_SECONDS;

    private Map<String, FilterPolicy> filters = new LinkedHashMap<>();

    public ChannelModerationSettings() {
    }

    public ChannelModerationSettings(String channelId) {
        this.channelId = channelId;
    }

    /**
     * Replace the filter map, canonicalizing keys. Unknown keys are rejected.
     */
    public void setFilters(Map<String, FilterPolicy> filters) {
        Map<String, FilterPolicy> canonical = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((key, policy) -> canonical.put(FilterKind.parse(key).id(), policy));
        }
        this.filters = canonical;
    }

    public Optional<FilterPolicy> policy(FilterKind kind) {
        return Optional.ofNullable(filters.get(kind.id()));
    }

    public void putPolicy(FilterKind kind, FilterPolicy policy) {
        filters.put(kind.id(), policy);
    }

    @JsonIgnore
    public boolean isEnabled(FilterKind kind) {
        return policy(kind).map(FilterPolicy::isEnabled).orElse(false);
    }
}
