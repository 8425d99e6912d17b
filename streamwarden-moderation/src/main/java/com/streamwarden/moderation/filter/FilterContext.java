package com.streamwarden.moderation.filter;

import com.streamwarden.common.level.Actor;
import com.streamwarden.moderation.ChatMessage;
import com.streamwarden.moderation.policy.CompiledPolicy;
import com.streamwarden.moderation.policy.FilterPolicy;
import com.streamwarden.moderation.text.MessageText;

import java.time.Instant;

/**
 * Everything a filter may look at for one message.
 */
public record FilterContext(ChatMessage message, MessageText text, CompiledPolicy compiled, Actor actor, Instant now) {

    public FilterPolicy policy() {
        return compiled.policy();
    }
}
