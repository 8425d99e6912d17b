package com.streamwarden.app.chat;

import java.util.Map;

/**
 * A chat message as delivered by the chat transport.
 *
 * @param badges    badge name to version, e.g. {@code moderator -> 1}
 * @param emotesTag raw emotes tag, e.g. {@code "25:0-4,12-16"}; may be null
 */
public record IncomingChatMessage(
        String channelId,
        String userId,
        String login,
        String text,
        Map<String, String> badges,
        String emotesTag) {

    public IncomingChatMessage {
        badges = badges != null ? Map.copyOf(badges) : Map.of();
    }
}
