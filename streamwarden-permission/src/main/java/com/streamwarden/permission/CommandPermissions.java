package com.streamwarden.permission;

import java.util.List;

/**
 * Naming convention for permissions that gate chat commands:
 * {@code can_<command>[_<arg>...]}.
 */
public final class CommandPermissions {

    public static final String PREFIX = "can_";

    private CommandPermissions() {
    }

    public static String permissionNameFor(String command) {
        return permissionNameFor(command, List.of(), 0);
    }

    /**
     * Include the first {@code argCount} arguments, so "permissions group
     * create" can be granted separately from "permissions group delete".
     */
    public static String permissionNameFor(String command, List<String> args, int argCount) {
        StringBuilder text = new StringBuilder(command == null ? "" : command.trim());
        for (int i = 0; i < argCount && i < args.size(); i++) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(args.get(i));
        }
        if (text.length() == 0) {
            throw new IllegalArgumentException("command required");
        }
        return PermissionNames.normalize(PREFIX + text);
    }
}
