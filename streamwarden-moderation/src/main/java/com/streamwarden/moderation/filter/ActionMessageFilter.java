package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

import java.util.Locale;

/**
 * Coloured "/me" messages, whether the transport hands them over as typed or
 * as a CTCP ACTION.
 */
public class ActionMessageFilter implements MessageFilter {

    static final String CTCP_ACTION = "\u0001ACTION";

    @Override
    public FilterKind kind() {
        return FilterKind.ACTION_MESSAGE;
    }

    @Override
    public boolean triggers(FilterContext context) {
        String raw = context.text().raw();
        if (raw.startsWith(CTCP_ACTION)) {
            return true;
        }
        String lower = raw.stripLeading().toLowerCase(Locale.ROOT);
        return lower.equals("/me") || lower.startsWith("/me ");
    }
}
