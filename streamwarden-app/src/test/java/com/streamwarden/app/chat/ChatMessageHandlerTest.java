package com.streamwarden.app.chat;

import com.streamwarden.app.WardenFixture;
import com.streamwarden.app.commands.CommandResult;
import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.level.UserLevel;
import com.streamwarden.moderation.ModerationDecision;
import com.streamwarden.moderation.ModerationOutcome;
import com.streamwarden.moderation.policy.FilterKind;
import com.streamwarden.moderation.policy.FilterPolicy;
import com.streamwarden.moderation.policy.ModerationDefaults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.streamwarden.app.WardenFixture.CHANNEL;
import static org.junit.jupiter.api.Assertions.*;

class ChatMessageHandlerTest {

    private WardenFixture fx;
    private RecordingExecutor executor;
    private RecordingSink sink;
    private ChatMessageHandler handler;

    @BeforeEach
    void setUp() {
        fx = new WardenFixture().loadBuiltInCommands();
        executor = new RecordingExecutor();
        sink = new RecordingSink();
        WardenConfig config = new WardenConfig();
        config.setBot(new WardenConfig.BotConfig());
        handler = new ChatMessageHandler(fx.actors, fx.moderator, executor, fx.commandProcessor, sink, config);
    }

    private static IncomingChatMessage message(String userId, String text, Map<String, String> badges) {
        return new IncomingChatMessage(CHANNEL, userId, "login" + userId, text, badges, null);
    }

    @Test
    void moderatorBadge_allowsModeratorCommand() {
        handler.handle(message("2", "!moderation enable caps", Map.of("moderator", "1")));

        assertEquals(1, sink.replies.size());
        assertEquals("@login2, the caps filter has been enabled.", sink.replies.get(0));
        assertTrue(fx.policyStore.find(CHANNEL).orElseThrow().isEnabled(FilterKind.CAPS));
    }

    @Test
    void badgesAreReadOnEveryMessage() {
        handler.handle(message("2", "hello", Map.of("moderator", "1")));
        handler.handle(message("2", "!moderation status", Map.of()));

        assertEquals("@login2, you do not have permission to use !moderation.", sink.replies.get(0));
        assertEquals(UserLevel.VIEWER, fx.actors.find(CHANNEL, "2").orElseThrow()
                .levelInChannel().asSet().iterator().next());
    }

    @Test
    void plainChat_getsNoReply() {
        assertTrue(handler.handle(message("5", "hello everyone", Map.of())).isEmpty());
        assertTrue(sink.replies.isEmpty());
        assertTrue(executor.applied.isEmpty());
    }

    @Test
    void punishedMessage_isNotRunAsCommand() {
        handler.handle(message("2", "!moderation enable lengthy-message", Map.of("moderator", "1")));
        sink.replies.clear();

        String longCommand = "!moderation status " + "x".repeat(300);
        Optional<ModerationOutcome> outcome = handler.handle(message("5", longCommand, Map.of()));

        assertTrue(outcome.isPresent());
        assertEquals(1, executor.applied.size());
        assertEquals(FilterKind.LENGTHY_MESSAGE, executor.applied.get(0).kind());
        assertTrue(sink.replies.isEmpty());
    }

    @Test
    void moderatorsAreExemptFromFilters() {
        handler.handle(message("2", "!moderation enable lengthy-message", Map.of("moderator", "1")));

        assertTrue(handler.handle(message("2", "y".repeat(400), Map.of("moderator", "1"))).isEmpty());
        assertTrue(executor.applied.isEmpty());
    }

    @Test
    void ownMessages_areIgnored() {
        handler.handle(new IncomingChatMessage(CHANNEL, "1", "StreamWarden", "!permit 5", Map.of("moderator", "1"),
                null));

        assertTrue(sink.replies.isEmpty());
        assertTrue(fx.actors.find(CHANNEL, "1").isEmpty());
    }

    @Test
    void emotesTag_isAppliedToFilters() {
        fx.policyStore.update(CHANNEL, settings -> {
            FilterPolicy emotes = ModerationDefaults.policy(FilterKind.EMOTES);
            emotes.setEnabled(true);
            emotes.setMaximumAllowed(2);
            settings.putPolicy(FilterKind.EMOTES, emotes);
            return settings;
        });

        assertTrue(handler.handle(message("5", "Kappa Kappa", Map.of())).isEmpty());
        IncomingChatMessage withEmotes = new IncomingChatMessage(CHANNEL, "6", "login6", "Kappa Kappa",
                Map.of(), "25:0-4,6-10");
        assertTrue(handler.handle(withEmotes).isPresent());
    }

    private static class RecordingExecutor implements ModerationActionExecutor {
        final List<ModerationDecision> applied = new ArrayList<>();

        @Override
        public void apply(String channelId, String userLogin, ModerationDecision decision, boolean sendNotice) {
            applied.add(decision);
        }
    }

    private static class RecordingSink implements ChatReplySink {
        final List<String> replies = new ArrayList<>();

        @Override
        public void send(String channelId, CommandResult reply) {
            replies.add(reply.text());
        }
    }
}
