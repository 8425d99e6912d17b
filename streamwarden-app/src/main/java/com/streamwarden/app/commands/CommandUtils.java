package com.streamwarden.app.commands;

import java.util.List;

/**
 * Shared helpers used across command handlers.
 */
public final class CommandUtils {

    public static final int PAGE_SIZE = 10;

    private CommandUtils() {
    }

    /** Number of pages needed for {@code items} entries, at least 1. */
    public static int pageCount(int items) {
        return Math.max(1, (items + PAGE_SIZE - 1) / PAGE_SIZE);
    }

    /** Clamp a requested page number into {@code [1, pageCount]}. */
    public static int clampPage(int requested, int items) {
        return Math.min(pageCount(items), Math.max(1, requested));
    }

    /** Entries of a 1-based page. */
    public static <T> List<T> page(List<T> items, int page) {
        int from = Math.min(items.size(), (clampPage(page, items.size()) - 1) * PAGE_SIZE);
        int to = Math.min(items.size(), from + PAGE_SIZE);
        return items.subList(from, to);
    }

    /** Parse a positive integer, or null when the text is not one. */
    public static Integer parsePositive(String text) {
        if (text == null || text.isEmpty() || text.length() > 9 || !text.chars().allMatch(Character::isDigit)) {
            return null;
        }
        int value = Integer.parseInt(text);
        return value > 0 ? value : null;
    }
}
