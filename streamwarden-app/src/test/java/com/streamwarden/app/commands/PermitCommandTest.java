package com.streamwarden.app.commands;

import com.streamwarden.app.WardenFixture;
import com.streamwarden.common.level.Actor;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.moderation.ChatMessage;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.ModerationDefaults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.streamwarden.app.WardenFixture.CHANNEL;
import static org.junit.jupiter.api.Assertions.*;

class PermitCommandTest {

    private WardenFixture fx;

    @BeforeEach
    void setUp() {
        fx = new WardenFixture().loadBuiltInCommands();
        fx.user("2", UserLevel.MODERATOR);
    }

    @Test
    void missingUser_showsUsage() {
        assertEquals("@user2, usage: !permit (UserId) [seconds]", fx.run("2", "!permit").text());
    }

    @Test
    void defaultDuration_withoutLinksSettings() {
        assertEquals("@user2, user 42 may post links for the next 60 seconds.", fx.run("2", "!permit 42").text());
        assertTrue(fx.permits.isPermitted(CHANNEL, "42", fx.clock.instant().plusSeconds(60)));
        assertFalse(fx.permits.isPermitted(CHANNEL, "42", fx.clock.instant().plusSeconds(61)));
    }

    @Test
    void explicitDuration_wins() {
        assertEquals("@user2, user 42 may post links for the next 300 seconds.",
                fx.run("2", "!permit 42 300").text());
    }

    @Test
    void invalidDuration_fallsBackToConfigured() {
        fx.policyStore.update(CHANNEL, settings -> {
            var links = ModerationDefaults.policy(FilterKind.LINKS);
            links.setEnabled(true);
            links.setPermitSeconds(120);
            settings.putPolicy(FilterKind.LINKS, links);
            return settings;
        });

        assertEquals("@user2, user 42 may post links for the next 120 seconds.",
                fx.run("2", "!permit 42 soon").text());
    }

    @Test
    void permittedUser_mayPostLinksUntilExpiry() {
        fx.run("2", "!moderation enable links");
        fx.run("2", "!permit 42");
        ChatMessage link = ChatMessage.of(CHANNEL, "42", "viewer42", "https://example.org");

        assertTrue(fx.moderator.moderate(link, Actor.viewer("42")).isEmpty());
        fx.clock.advance(Duration.ofSeconds(61));
        assertTrue(fx.moderator.moderate(link, Actor.viewer("42")).isPresent());
    }

    @Test
    void viewer_isDenied() {
        assertTrue(fx.run("5", "!permit 42").text().contains("do not have permission"));
    }
}
