package com.streamwarden.app.chat;

import com.streamwarden.moderation.ModerationDecision;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.PunishmentSpec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingActionExecutorTest {

    @Test
    void chatCommandFor_eachKind() {
        assertNull(LoggingActionExecutor.chatCommandFor("bob", PunishmentSpec.none()));
        assertEquals("/delete (message of bob)", LoggingActionExecutor.chatCommandFor("bob",
                PunishmentSpec.delete("rude")));
        assertEquals("/timeout bob 1 Fake purge", LoggingActionExecutor.chatCommandFor("bob",
                PunishmentSpec.purge("Fake purge")));
        assertEquals("/timeout bob 600 Spamming", LoggingActionExecutor.chatCommandFor("bob",
                PunishmentSpec.timeout(600, "Spamming")));
        assertEquals("/ban bob", LoggingActionExecutor.chatCommandFor("bob", PunishmentSpec.ban(null)));
    }

    @Test
    void apply_logsWithoutFailing() {
        ModerationDecision decision = new ModerationDecision(FilterKind.CAPS, ModerationDecision.Tier.WARNING,
                PunishmentSpec.timeout(5, "Excessive caps").withMessage("please stop shouting"),
                FilterKind.CAPS.id());

        assertDoesNotThrow(() -> new LoggingActionExecutor().apply("1000", "bob", decision, true));
    }
}
