package com.streamwarden.moderation;

import com.streamwarden.moderation.text.EmoteRange;

import java.util.List;

/**
 * One chat message as the moderation engine sees it.
 *
 * @param emotes emote positions, see {@link EmoteRange}
 */
public record ChatMessage(String channelId, String userId, String userLogin, String text, List<EmoteRange> emotes) {

    public ChatMessage {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId required");
        }
        text = text != null ? text : "";
        emotes = emotes != null ? List.copyOf(emotes) : List.of();
    }

    public static ChatMessage of(String channelId, String userId, String userLogin, String text) {
        return new ChatMessage(channelId, userId, userLogin, text, List.of());
    }
}
