package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

import java.util.Locale;
import java.util.Set;

/**
 * Messages imitating the notice Twitch shows in place of a deleted message.
 */
public class FakePurgeFilter implements MessageFilter {

    static final Set<String> DELETION_NOTICES = Set.of(
            "<message deleted>",
            "<deleted message>",
            "message deleted by a moderator.",
            "message removed by a moderator.");

    @Override
    public FilterKind kind() {
        return FilterKind.FAKE_PURGE;
    }

    @Override
    public boolean triggers(FilterContext context) {
        String normalized = context.text().raw().trim().toLowerCase(Locale.ROOT);
        return DELETION_NOTICES.contains(normalized);
    }
}
