package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.ChatMessage;
import com.streamwarden.moderation.policy.CompiledBlacklistEntry;

import java.util.List;
import java.util.Optional;

/**
 * Walks the blacklist in order; the first matching entry wins.
 */
public final class BlacklistMatcher {

    private BlacklistMatcher() {
    }

    public static Optional<CompiledBlacklistEntry> firstMatch(List<CompiledBlacklistEntry> entries, ChatMessage message) {
        for (CompiledBlacklistEntry entry : entries) {
            if (entry.matches(message.text(), message.userLogin())) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
