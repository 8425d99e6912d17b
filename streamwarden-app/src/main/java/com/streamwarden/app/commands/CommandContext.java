package com.streamwarden.app.commands;

import com.streamwarden.common.level.Actor;

/**
 * Context passed to every command handler.
 *
 * @param actor         the sender as seen in the channel
 * @param commandPrefix prefix the command was invoked with, for usage texts
 */
public record CommandContext(
        String channelId,
        Actor actor,
        String senderLogin,
        String commandPrefix) {

    /** Name to address the sender by in replies. */
    public String mention() {
        return "@" + (senderLogin != null ? senderLogin : actor.userId());
    }
}
