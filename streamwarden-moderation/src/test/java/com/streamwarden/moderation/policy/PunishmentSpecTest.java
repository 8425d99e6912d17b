package com.streamwarden.moderation.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PunishmentSpecTest {

    @Test
    void severityOrder() {
        assertTrue(PunishmentSpec.ban("x").isHarsherThan(PunishmentSpec.timeout(86_400, "x")));
        assertTrue(PunishmentSpec.timeout(1, "x").isHarsherThan(PunishmentSpec.purge("x")));
        assertTrue(PunishmentSpec.purge("x").isHarsherThan(PunishmentSpec.delete("x")));
        assertTrue(PunishmentSpec.delete("x").isHarsherThan(PunishmentSpec.none()));
        assertFalse(PunishmentSpec.delete("x").isHarsherThan(PunishmentSpec.ban("x")));
    }

    @Test
    void longerTimeoutIsHarsher() {
        assertTrue(PunishmentSpec.timeout(600, "x").isHarsherThan(PunishmentSpec.timeout(30, "x")));
        assertFalse(PunishmentSpec.timeout(30, "x").isHarsherThan(PunishmentSpec.timeout(30, "y")));
    }

    @Test
    void anythingButNoneBeatsNothing() {
        assertTrue(PunishmentSpec.delete("x").isHarsherThan(null));
        assertFalse(PunishmentSpec.none().isHarsherThan(null));
    }

    @Test
    void negativeDuration_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> PunishmentSpec.timeout(-1, "x"));
    }

    @Test
    void nullKind_meansNone() {
        assertTrue(new PunishmentSpec(null, 0, null, null).isNone());
    }
}
