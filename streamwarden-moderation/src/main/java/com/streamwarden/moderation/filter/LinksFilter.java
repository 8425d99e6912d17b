package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.LinkAllowlist;
import com.streamwarden.moderation.state.LinkPermits;

/**
 * Any link not on the channel allowlist, unless the author holds a permit.
 */
public class LinksFilter implements MessageFilter {

    private final LinkPermits permits;

    public LinksFilter(LinkPermits permits) {
        this.permits = permits;
    }

    @Override
    public FilterKind kind() {
        return FilterKind.LINKS;
    }

    @Override
    public boolean triggers(FilterContext context) {
        LinkAllowlist allowlist = context.compiled().allowlist();
        boolean offending = LinkDetector.find(context.text().stripped(), context.policy().isAggressiveDetection())
                .stream()
                .anyMatch(link -> !allowlist.allows(link.text(), link.host()));
        if (!offending) {
            return false;
        }
        return !permits.isPermitted(context.message().channelId(), context.message().userId(), context.now());
    }
}
