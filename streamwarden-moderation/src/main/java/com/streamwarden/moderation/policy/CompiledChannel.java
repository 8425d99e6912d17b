package com.streamwarden.moderation.policy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enabled, valid filters of one channel. A channel without a document
 * compiles to no filters at all.
 *
 * @param problems validation problems of enabled filters that were left out
 */
public record CompiledChannel(
        String channelId,
        Map<FilterKind, CompiledPolicy> filters,
        Duration noticeCooldown,
        Map<FilterKind, List<String>> problems) {

    public static CompiledChannel unconfigured(String channelId) {
        return new CompiledChannel(channelId, Map.of(), Duration.ZERO, Map.of());
    }

    public Optional<CompiledPolicy> filter(FilterKind kind) {
        return Optional.ofNullable(filters.get(kind));
    }
}
