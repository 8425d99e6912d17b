package com.streamwarden.app.chat;

import com.streamwarden.app.commands.CommandContext;
import com.streamwarden.app.commands.CommandProcessor;
import com.streamwarden.app.commands.CommandResult;
import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.level.Actor;
import com.streamwarden.moderation.ChatMessage;
import com.streamwarden.moderation.ChatModerator;
import com.streamwarden.moderation.ModerationOutcome;
import com.streamwarden.moderation.text.EmoteRange;
import com.streamwarden.permission.BadgeLevelParser;
import com.streamwarden.permission.actor.ActorDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Entry point for every chat message: refresh the sender's levels from the
 * badges, moderate the message, and run it as a command if it survived.
 */
@Slf4j
@Component
public class ChatMessageHandler {

    private final ActorDirectory actors;
    private final ChatModerator moderator;
    private final ModerationActionExecutor executor;
    private final CommandProcessor commandProcessor;
    private final ChatReplySink replySink;
    private final WardenConfig config;

    public ChatMessageHandler(ActorDirectory actors, ChatModerator moderator, ModerationActionExecutor executor,
            CommandProcessor commandProcessor, ChatReplySink replySink, WardenConfig config) {
        this.actors = actors;
        this.moderator = moderator;
        this.executor = executor;
        this.commandProcessor = commandProcessor;
        this.replySink = replySink;
        this.config = config;
    }

    /**
     * @return the moderation outcome, empty when the message was not punished
     */
    public Optional<ModerationOutcome> handle(IncomingChatMessage incoming) {
        if (isOwnMessage(incoming)) {
            return Optional.empty();
        }
        Actor actor = actors.observe(incoming.channelId(), incoming.userId(),
                BadgeLevelParser.parse(incoming.badges()));
        ChatMessage message = new ChatMessage(incoming.channelId(), incoming.userId(), incoming.login(),
                incoming.text(), EmoteRange.parseTag(incoming.emotesTag()));

        Optional<ModerationOutcome> outcome = moderator.moderate(message, actor);
        if (outcome.isPresent()) {
            executor.apply(incoming.channelId(), incoming.login(), outcome.get().decision(),
                    outcome.get().sendNotice());
            return outcome;
        }

        String prefix = config.getBot().getCommandPrefix();
        CommandResult reply = commandProcessor.handleCommand(incoming.text(),
                new CommandContext(incoming.channelId(), actor, incoming.login(), prefix));
        if (reply != null && reply.text() != null) {
            replySink.send(incoming.channelId(), reply);
        }
        return Optional.empty();
    }

    private boolean isOwnMessage(IncomingChatMessage incoming) {
        String botLogin = config.getBot().getLogin();
        return botLogin != null && botLogin.equalsIgnoreCase(incoming.login());
    }
}
