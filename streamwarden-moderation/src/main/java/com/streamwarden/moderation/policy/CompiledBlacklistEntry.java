package com.streamwarden.moderation.policy;

import java.util.regex.Pattern;

/**
 * A blacklist entry with its pattern compiled once, at policy load.
 */
public record CompiledBlacklistEntry(BlacklistEntry entry, Pattern pattern) {

    public static CompiledBlacklistEntry compile(BlacklistEntry entry) {
        String source = entry.regex() ? entry.phrase() : Pattern.quote(entry.phrase());
        return new CompiledBlacklistEntry(entry,
                Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String message, String userLogin) {
        return switch (entry.matchOn()) {
            case MESSAGE -> find(message);
            case USERNAME -> find(userLogin);
            case MESSAGE_AND_USERNAME -> find(message) || find(userLogin);
        };
    }

    private boolean find(String target) {
        return target != null && pattern.matcher(target).find();
    }
}
