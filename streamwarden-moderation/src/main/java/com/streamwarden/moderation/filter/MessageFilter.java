package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;

/**
 * Trigger predicate of one filter kind. Implementations only answer "does
 * this message break the rule"; exemptions and tiering happen in the engine.
 */
public interface MessageFilter {

    FilterKind kind();

    boolean triggers(FilterContext context);

    /**
     * Length gate shared by the ratio filters: messages shorter than two
     * characters never trigger.
     */
    static int minimumLength(Integer configured) {
        return Math.max(configured != null ? configured : 0, 2);
    }
}
