package com.streamwarden.app.commands;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Arguments of a chat command: the words, plus the raw text so trailing
 * arguments can keep their spaces (group names like "Trusted Regulars").
 */
public final class CommandArgs {

    private static final Pattern WORD = Pattern.compile("\\S+");

    private final String raw;
    private final List<String> words;
    private final int[] starts;

    private CommandArgs(String raw) {
        this.raw = raw;
        Matcher m = WORD.matcher(raw);
        List<String> found = new ArrayList<>();
        int[] positions = new int[raw.length() + 1];
        while (m.find()) {
            positions[found.size()] = m.start();
            found.add(m.group());
        }
        this.words = List.copyOf(found);
        this.starts = Arrays.copyOf(positions, found.size());
    }

    public static CommandArgs parse(String raw) {
        return new CommandArgs(raw == null ? "" : raw.trim());
    }

    public String raw() {
        return raw;
    }

    public List<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    /** Word at {@code index}, or null past the end. */
    public String get(int index) {
        return index < words.size() ? words.get(index) : null;
    }

    /** Lower-cased word at {@code index}, or {@code fallback} past the end. */
    public String keyword(int index, String fallback) {
        String word = get(index);
        return word != null ? word.toLowerCase(Locale.ROOT) : fallback;
    }

    /** Everything from word {@code index} to the end, or null past the end. */
    public String rest(int index) {
        if (index >= words.size()) {
            return null;
        }
        return raw.substring(starts[index]).trim();
    }
}
