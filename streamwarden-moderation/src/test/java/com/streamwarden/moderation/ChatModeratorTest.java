package com.streamwarden.moderation;

import com.streamwarden.common.level.Actor;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.PunishmentKind;
import com.streamwarden.moderation.policy.PunishmentSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.streamwarden.moderation.ModerationFixture.CHANNEL;
import static com.streamwarden.moderation.ModerationFixture.message;
import static org.junit.jupiter.api.Assertions.*;

class ChatModeratorTest {

    private ModerationFixture fx;
    private final Actor viewer = Actor.viewer("42");

    @BeforeEach
    void setUp() {
        fx = new ModerationFixture();
    }

    @Test
    void cleanMessage_isLeftAlone() {
        fx.enable(FilterKind.LENGTHY_MESSAGE, p -> p.setMaximumLength(100));
        assertTrue(fx.moderator.moderate(message("hi chat"), viewer).isEmpty());
        assertEquals(1, fx.messageCache.size(CHANNEL));
    }

    @Test
    void harshestDecision_wins() {
        fx.enable(FilterKind.LENGTHY_MESSAGE, p -> p.setMaximumLength(5));
        fx.enable(FilterKind.FAKE_PURGE, p -> {
            p.setWarningTier(PunishmentSpec.ban("fake purge"));
            p.setRepeatTier(PunishmentSpec.ban("fake purge"));
        });

        ModerationOutcome outcome = fx.moderator.moderate(message("<message deleted>"), viewer).orElseThrow();

        assertEquals(FilterKind.FAKE_PURGE, outcome.decision().kind());
        assertEquals(PunishmentKind.BAN, outcome.decision().punishment().kind());
    }

    @Test
    void decision_isLogged() {
        fx.enable(FilterKind.LENGTHY_MESSAGE, p -> p.setMaximumLength(5));

        fx.moderator.moderate(message("way too long"), viewer);

        List<ModerationLog.Entry> entries = fx.moderationLog.recent(CHANNEL, 10);
        assertEquals(1, entries.size());
        assertEquals("42", entries.get(0).userId());
        assertEquals(FilterKind.LENGTHY_MESSAGE, entries.get(0).kind());
        assertEquals(ModerationDecision.Tier.WARNING, entries.get(0).tier());
    }

    @Test
    void notice_isThrottledPerChannel_punishmentIsNot() {
        fx.store.update(CHANNEL, s -> {
            s.setNoticeCooldownSeconds(30);
            return s;
        });
        fx.enable(FilterKind.LENGTHY_MESSAGE, p -> {
            p.setMaximumLength(5);
            p.setWarningTier(PunishmentSpec.timeout(10, "long").withMessage("Keep it short"));
            p.setRepeatTier(PunishmentSpec.timeout(60, "long").withMessage("Keep it short"));
        });

        Optional<ModerationOutcome> first = fx.moderator.moderate(message("way too long"), viewer);
        fx.clock.advance(Duration.ofSeconds(10));
        Optional<ModerationOutcome> second = fx.moderator.moderate(
                ChatMessage.of(CHANNEL, "43", "other", "also too long"), Actor.viewer("43"));
        fx.clock.advance(Duration.ofSeconds(20));
        Optional<ModerationOutcome> third = fx.moderator.moderate(
                ChatMessage.of(CHANNEL, "44", "third", "still too long"), Actor.viewer("44"));

        assertTrue(first.orElseThrow().sendNotice());
        assertFalse(second.orElseThrow().sendNotice());
        assertTrue(third.orElseThrow().sendNotice());
    }

    @Test
    void oneManSpam_countsCachedMessages() {
        fx.enable(FilterKind.ONE_MAN_SPAM, p -> {
            p.setMaximumMessages(3);
            p.setResetWindowSeconds(10);
        });

        assertTrue(fx.moderator.moderate(message("one"), viewer).isEmpty());
        fx.clock.advance(Duration.ofSeconds(1));
        assertTrue(fx.moderator.moderate(message("two"), viewer).isEmpty());
        fx.clock.advance(Duration.ofSeconds(1));
        assertTrue(fx.moderator.moderate(message("three"), viewer).isPresent());

        fx.clock.advance(Duration.ofSeconds(30));
        assertTrue(fx.moderator.moderate(message("later"), viewer).isEmpty());
    }

    @Test
    void linkPermit_exemptsFromLinksFilter() {
        fx.enable(FilterKind.LINKS, p -> p.setAllowlist(List.of("twitch.tv")));

        assertTrue(fx.moderator.moderate(message("watch www.twitch.tv/somebody"), viewer).isEmpty());
        assertTrue(fx.moderator.moderate(message("free stuff at example.com"), viewer).isPresent());

        fx.permits.grant(CHANNEL, "42", Duration.ofSeconds(60), fx.clock.instant());
        assertTrue(fx.moderator.moderate(message("see example.com"), viewer).isEmpty());

        fx.clock.advance(Duration.ofSeconds(61));
        assertTrue(fx.moderator.moderate(message("see example.com"), viewer).isPresent());
    }
}
