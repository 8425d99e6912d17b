package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

public class LengthyMessageFilter implements MessageFilter {

    @Override
    public FilterKind kind() {
        return FilterKind.LENGTHY_MESSAGE;
    }

    @Override
    public boolean triggers(FilterContext context) {
        return context.text().rawLength() > context.policy().getMaximumLength();
    }
}
