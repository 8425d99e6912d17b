package com.streamwarden.moderation.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * What to do to a message author. A {@code PURGE} is a one-second timeout that
 * clears the user's messages; {@code durationSeconds} only matters for
 * {@code TIMEOUT}.
 *
 * @param reasonText        reason attached to the timeout or ban
 * @param userFacingMessage chat notice sent with the punishment, or null for none
 */
public record PunishmentSpec(PunishmentKind kind, int durationSeconds, String reasonText, String userFacingMessage) {

    public PunishmentSpec {
        kind = kind != null ? kind : PunishmentKind.NONE;
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative");
        }
    }

    public static PunishmentSpec none() {
        return new PunishmentSpec(PunishmentKind.NONE, 0, null, null);
    }

    public static PunishmentSpec delete(String reason) {
        return new PunishmentSpec(PunishmentKind.DELETE, 0, reason, null);
    }

    public static PunishmentSpec purge(String reason) {
        return new PunishmentSpec(PunishmentKind.PURGE, 1, reason, null);
    }

    public static PunishmentSpec timeout(int seconds, String reason) {
        return new PunishmentSpec(PunishmentKind.TIMEOUT, seconds, reason, null);
    }

    public static PunishmentSpec ban(String reason) {
        return new PunishmentSpec(PunishmentKind.BAN, 0, reason, null);
    }

    public PunishmentSpec withMessage(String message) {
        return new PunishmentSpec(kind, durationSeconds, reasonText, message);
    }

    @JsonIgnore
    public boolean isNone() {
        return kind == PunishmentKind.NONE;
    }

    /**
     * Ban beats timeout beats purge beats delete beats none; between two
     * timeouts the longer one is harsher.
     */
    public boolean isHarsherThan(PunishmentSpec other) {
        if (other == null) {
            return !isNone();
        }
        if (kind != other.kind) {
            return kind.severity() > other.kind.severity();
        }
        return kind == PunishmentKind.TIMEOUT && durationSeconds > other.durationSeconds;
    }
}
