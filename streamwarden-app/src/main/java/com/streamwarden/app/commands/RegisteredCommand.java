package com.streamwarden.app.commands;

import com.streamwarden.common.level.UserLevels;

/**
 * A chat command known to the {@link CommandProcessor}.
 *
 * @param ownerId      plugin that registered the command
 * @param defaultLevel levels allowed without a custom permission
 * @param argDepth     number of leading arguments that are part of the
 *                     permission name, so {@code permissions group} and
 *                     {@code permissions user} can be granted separately
 */
public record RegisteredCommand(
        String name,
        String ownerId,
        UserLevels defaultLevel,
        int argDepth,
        String description,
        CommandHandler handler) {

    public RegisteredCommand {
        if (name == null || name.isBlank() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("command name must be a single word: " + name);
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler required for command " + name);
        }
        defaultLevel = defaultLevel != null ? defaultLevel : UserLevels.none();
        argDepth = Math.max(0, argDepth);
    }
}
