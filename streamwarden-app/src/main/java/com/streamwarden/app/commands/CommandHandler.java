package com.streamwarden.app.commands;

/**
 * Functional interface for chat command handlers.
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * Handle a command.
     *
     * @param args the words after the command name, may be empty
     * @param ctx  channel, sender and prefix of the invocation
     * @return reply to send, or null for no reply
     */
    CommandResult handle(CommandArgs args, CommandContext ctx);
}
