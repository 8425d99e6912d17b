package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

public class EmotesFilter implements MessageFilter {

    @Override
    public FilterKind kind() {
        return FilterKind.EMOTES;
    }

    @Override
    public boolean triggers(FilterContext context) {
        if (context.text().emoteCount() >= context.policy().getMaximumAllowed()) {
            return true;
        }
        return Boolean.TRUE.equals(context.policy().getRemoveOnlyEmotes()) && context.text().isOnlyEmotes();
    }
}
