package com.streamwarden.app.chat;

import com.streamwarden.moderation.ModerationDecision;

/**
 * Carries out a moderation decision on the chat platform.
 */
public interface ModerationActionExecutor {

    /**
     * @param sendNotice whether the punishment's chat notice should be posted
     */
    void apply(String channelId, String userLogin, ModerationDecision decision, boolean sendNotice);
}
