package com.streamwarden.app.chat;

import com.streamwarden.app.commands.CommandResult;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingReplySink implements ChatReplySink {

    @Override
    public void send(String channelId, CommandResult reply) {
        log.info("[#{}] {}", channelId, reply.text());
    }
}
