package com.streamwarden.moderation;

/**
 * The punishment to apply to a message and whether to announce it in chat.
 */
public record ModerationOutcome(ModerationDecision decision, boolean sendNotice) {
}
