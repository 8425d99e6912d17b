package com.streamwarden.moderation.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position of one emote in a chat message, as code point indexes with an
 * inclusive end (the Twitch {@code emotes} tag convention).
 */
public record EmoteRange(int start, int end) {

    public static final Comparator<EmoteRange> BY_START = Comparator.comparingInt(EmoteRange::start)
            .thenComparingInt(EmoteRange::end);

    private static final Pattern POSITION = Pattern.compile("\\s*(\\d{1,9})\\s*-\\s*(\\d{1,9})\\s*");

    /**
     * Parse the IRC tag form, e.g. {@code "25:0-4,12-16/1902:6-10"}. Malformed
     * positions are skipped.
     */
    public static List<EmoteRange> parseTag(String emotesTag) {
        List<EmoteRange> ranges = new ArrayList<>();
        if (emotesTag == null || emotesTag.isBlank()) {
            return ranges;
        }
        for (String emote : emotesTag.split("/")) {
            int colon = emote.indexOf(':');
            if (colon < 0) {
                continue;
            }
            for (String position : emote.substring(colon + 1).split(",")) {
                Matcher m = POSITION.matcher(position);
                if (m.matches()) {
                    ranges.add(new EmoteRange(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
                }
            }
        }
        ranges.sort(BY_START);
        return ranges;
    }
}
