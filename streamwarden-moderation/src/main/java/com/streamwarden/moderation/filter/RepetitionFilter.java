package com.streamwarden.moderation.filter;

import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.FilterPolicy;
import com.streamwarden.moderation.text.MessageText;

/**
 * The same character, or the same word, repeated back to back too often.
 * The length gate counts the whole message, emotes included; the runs are
 * looked for in the text without emotes.
 */
public class RepetitionFilter implements MessageFilter {

    @Override
    public FilterKind kind() {
        return FilterKind.REPETITION;
    }

    @Override
    public boolean triggers(FilterContext context) {
        MessageText text = context.text();
        FilterPolicy policy = context.policy();
        if (text.rawLength() < MessageFilter.minimumLength(policy.getMinimumMessageLength())) {
            return false;
        }
        return text.longestCharacterRun() >= policy.getMaximumRepeatingCharacters()
                || text.longestWordRun() >= policy.getMaximumRepeatingWords();
    }
}
