package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.state.MessageCache;

import java.time.Instant;

/**
 * Too many messages from one user inside the reset window. Counts the
 * message cache, which already holds the message under evaluation.
 */
public class OneManSpamFilter implements MessageFilter {

    private final MessageCache messageCache;

    public OneManSpamFilter(MessageCache messageCache) {
        this.messageCache = messageCache;
    }

    @Override
    public FilterKind kind() {
        return FilterKind.ONE_MAN_SPAM;
    }

    @Override
    public boolean triggers(FilterContext context) {
        Instant since = context.now().minusSeconds(context.policy().getResetWindowSeconds());
        int sent = messageCache.countFromUserSince(context.message().channelId(), context.message().userId(), since);
        return sent >= context.policy().getMaximumMessages();
    }
}
