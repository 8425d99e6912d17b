package com.streamwarden.moderation.policy;

import java.time.Duration;
import java.util.List;

/**
 * A validated filter policy with everything the hot path needs precomputed.
 *
 * @param warningWindow effective escalation window, after the per-filter
 *                      override and the channel default
 */
public record CompiledPolicy(
        FilterKind kind,
        FilterPolicy policy,
        Duration warningWindow,
        List<CompiledBlacklistEntry> blacklist,
        LinkAllowlist allowlist) {
}
