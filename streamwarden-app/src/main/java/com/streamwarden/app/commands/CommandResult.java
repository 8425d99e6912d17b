package com.streamwarden.app.commands;

/**
 * Reply of a command handler, sent back to the channel.
 */
public record CommandResult(String text) {

    public static CommandResult text(String text) {
        return new CommandResult(text);
    }

    public static CommandResult format(String format, Object... args) {
        return new CommandResult(String.format(format, args));
    }
}
