package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.FilterPolicy;
import com.streamwarden.moderation.text.MessageText;

/**
 * Too many symbols overall, or one symbol repeated too often in a row.
 */
public class SymbolsFilter implements MessageFilter {

    @Override
    public FilterKind kind() {
        return FilterKind.SYMBOLS;
    }

    @Override
    public boolean triggers(FilterContext context) {
        MessageText text = context.text();
        FilterPolicy policy = context.policy();
        if (text.strippedLength() < MessageFilter.minimumLength(policy.getMinimumMessageLength())) {
            return false;
        }
        return text.reachesPercentage(text.symbolCount(), policy.getMaximumPercentage())
                || text.longestSymbolRun() >= policy.getMaximumGrouped();
    }
}
