package com.streamwarden.moderation.text;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A chat message with its emotes removed, plus the counting helpers the
 * filters share. Built once per message.
 */
public final class MessageText {

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final String SYMBOL_CLASS = "[-!$%#^&*()_+|~=`{}\\[\\]:'<>?,./\\\\;\"]";
    private static final Pattern SYMBOL = Pattern.compile(SYMBOL_CLASS);
    private static final Pattern GROUPED_SYMBOLS = Pattern.compile("(" + SYMBOL_CLASS + ")\\1+");
    private static final Pattern REPEATED_CHARACTERS = Pattern.compile("(\\S)\\1+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String raw;
    private final String stripped;
    private final int emoteCount;

    private MessageText(String raw, String stripped, int emoteCount) {
        this.raw = raw;
        this.stripped = stripped;
        this.emoteCount = emoteCount;
    }

    public static MessageText of(String text, List<EmoteRange> emotes) {
        String raw = text != null ? text : "";
        List<EmoteRange> ranges = emotes != null ? emotes : List.of();
        return new MessageText(raw, stripEmotes(raw, ranges).trim(), ranges.size());
    }

    /**
     * Remove every emote range from the text. Ranges are clamped to the text,
     * and overlapping or unsorted ranges are fine.
     */
    public static String stripEmotes(String text, List<EmoteRange> emotes) {
        if (emotes == null || emotes.isEmpty() || text.isEmpty()) {
            return text;
        }
        int[] codePoints = text.codePoints().toArray();
        boolean[] removed = new boolean[codePoints.length];
        for (EmoteRange range : emotes) {
            int from = Math.max(0, Math.min(range.start(), range.end()));
            int to = Math.min(codePoints.length - 1, Math.max(range.start(), range.end()));
            for (int i = from; i <= to; i++) {
                removed[i] = true;
            }
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < codePoints.length; i++) {
            if (!removed[i]) {
                sb.appendCodePoint(codePoints[i]);
            }
        }
        return sb.toString();
    }

    public String raw() {
        return raw;
    }

    /** Text without emotes, trimmed. */
    public String stripped() {
        return stripped;
    }

    public int emoteCount() {
        return emoteCount;
    }

    public int rawLength() {
        return raw.codePointCount(0, raw.length());
    }

    public int strippedLength() {
        return stripped.codePointCount(0, stripped.length());
    }

    public boolean isOnlyEmotes() {
        return emoteCount > 0 && stripped.isBlank();
    }

    public int uppercaseCount() {
        return count(UPPERCASE, stripped);
    }

    public int symbolCount() {
        return count(SYMBOL, stripped);
    }

    /** Longest run of one symbol repeated back to back, e.g. 4 for "!!!!". */
    public int longestSymbolRun() {
        return longestMatch(GROUPED_SYMBOLS, stripped, 1);
    }

    /** Longest run of one non-space character repeated back to back. */
    public int longestCharacterRun() {
        return longestMatch(REPEATED_CHARACTERS, stripped, stripped.isBlank() ? 0 : 1);
    }

    /** Longest run of the same word repeated back to back, ignoring case. */
    public int longestWordRun() {
        if (stripped.isBlank()) {
            return 0;
        }
        String[] words = WHITESPACE.split(stripped.toLowerCase(Locale.ROOT));
        int longest = 1;
        int current = 1;
        for (int i = 1; i < words.length; i++) {
            current = words[i].equals(words[i - 1]) ? current + 1 : 1;
            longest = Math.max(longest, current);
        }
        return longest;
    }

    /**
     * Whether {@code part} makes up at least {@code percentage} percent of the
     * stripped text. False when the stripped text is empty.
     */
    public boolean reachesPercentage(int part, int percentage) {
        int length = strippedLength();
        if (length == 0) {
            return false;
        }
        return part * 100L >= (long) percentage * length;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static int longestMatch(Pattern pattern, String text, int floor) {
        Matcher m = pattern.matcher(text);
        int longest = floor;
        while (m.find()) {
            String match = m.group();
            longest = Math.max(longest, match.codePointCount(0, match.length()));
        }
        return longest;
    }
}
