package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.text.MessageText;

public class CapsFilter implements MessageFilter {

    @Override
    public FilterKind kind() {
        return FilterKind.CAPS;
    }

    @Override
    public boolean triggers(FilterContext context) {
        MessageText text = context.text();
        if (text.strippedLength() < MessageFilter.minimumLength(context.policy().getMinimumMessageLength())) {
            return false;
        }
        return text.reachesPercentage(text.uppercaseCount(), context.policy().getMaximumPercentage());
    }
}
