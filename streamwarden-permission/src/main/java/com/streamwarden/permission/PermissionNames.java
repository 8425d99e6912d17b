package com.streamwarden.permission;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of permission names: trimmed, lower-cased, whitespace runs
 * collapsed to a single underscore. "Can Edit  Quotes" becomes
 * "can_edit_quotes".
 */
public final class PermissionNames {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PermissionNames() {
    }

    /**
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("permission name required");
        }
        return WHITESPACE.matcher(name.trim()).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String name) {
        return name == null || name.isBlank();
    }
}
