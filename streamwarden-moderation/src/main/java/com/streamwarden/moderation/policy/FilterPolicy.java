package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.streamwarden.common.level.UserLevels;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of one filter in one channel. Thresholds a kind does not use stay
 * null; {@link FilterPolicyValidator} knows which ones each kind needs.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterPolicy {

    private boolean enabled;

    /** Levels that bypass this filter, on top of broadcaster and moderator. */
    private UserLevels excludedLevels = UserLevels.none();

    private PunishmentSpec warningTier;
    private PunishmentSpec repeatTier;

    /** Overrides the channel escalation window for this filter. */
    private Integer warningWindowSeconds;

    // --- thresholds ---

    private Integer minimumMessageLength;
    private Integer maximumPercentage;
    private Integer maximumGrouped;
    private Integer maximumLength;
    private Integer maximumRepeatingCharacters;
    private Integer maximumRepeatingWords;
    private Integer maximumAllowed;
    private Boolean removeOnlyEmotes;
    private Integer maximumMessages;
    private Integer resetWindowSeconds;

    // --- links ---

    /** Domains (and their subdomains) or URI prefixes that are always allowed. */
    private List<String> allowlist;
    private Integer permitSeconds;
    /** Also catch obfuscated links such as "example (dot) com". */
    private boolean aggressiveDetection;
    /** Allow Twitch clip links. */
    private boolean allowClips;

    // --- blacklist ---

    private List<BlacklistEntry> blacklist;

    public List<BlacklistEntry> blacklistOrEmpty() {
        return blacklist != null ? blacklist : List.of();
    }

    public List<String> allowlistOrEmpty() {
        return allowlist != null ? allowlist : List.of();
    }

    public void addBlacklistEntry(BlacklistEntry entry) {
        if (blacklist == null) {
            blacklist = new ArrayList<>();
        }
        blacklist.add(entry);
    }
}
