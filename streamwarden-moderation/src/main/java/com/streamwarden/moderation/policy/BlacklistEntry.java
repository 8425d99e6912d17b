package com.streamwarden.moderation.policy;

/**
 * One blacklisted phrase or pattern with its own punishment.
 *
 * @param phrase plain text matched case-insensitively anywhere in the target,
 *               or a regular expression when {@code regex} is set
 */
public record BlacklistEntry(String name, String phrase, boolean regex, MatchOn matchOn, PunishmentSpec punishment) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 600;

    public BlacklistEntry {
        matchOn = matchOn != null ? matchOn : MatchOn.MESSAGE;
        punishment = punishment != null ? punishment : PunishmentSpec.timeout(DEFAULT_TIMEOUT_SECONDS, null);
    }

    public static BlacklistEntry phrase(String name, String phrase, PunishmentSpec punishment) {
        return new BlacklistEntry(name, phrase, false, MatchOn.MESSAGE, punishment);
    }

    public static BlacklistEntry pattern(String name, String regex, MatchOn matchOn, PunishmentSpec punishment) {
        return new BlacklistEntry(name, regex, true, matchOn, punishment);
    }

    /** Name for logs: the configured name, or the phrase itself. */
    public String label() {
        return name != null && !name.isBlank() ? name : phrase;
    }
}
