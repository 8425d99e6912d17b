package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The content filters a channel can enable.
 */
public enum FilterKind {
    CAPS("caps"),
    SYMBOLS("symbols"),
    ZALGO("zalgo"),
    LINKS("links"),
    LENGTHY_MESSAGE("lengthy-message"),
    REPETITION("repetition"),
    EMOTES("emotes"),
    FAKE_PURGE("fake-purge"),
    ACTION_MESSAGE("action-message"),
    ONE_MAN_SPAM("one-man-spam"),
    BLACKLIST("blacklist");

    private final String id;

    FilterKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Blacklist entries carry their own punishment; every other kind
     * escalates from the warning tier to the repeat tier.
     */
    public boolean isTiered() {
        return this != BLACKLIST;
    }

    /**
     * Accepts the id ("lengthy-message"), the constant name
     * ("LENGTHY_MESSAGE") or a spaced form ("lengthy message").
     */
    @JsonCreator
    public static FilterKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("filter name required");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (FilterKind kind : values()) {
            if (kind.id.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown filter: " + raw);
    }
}
