package com.streamwarden.permission;

/**
 * Outcome of a permission check, with the rule that decided it.
 */
public record PermissionDecision(boolean allowed, String reason) {

    public static PermissionDecision allow(String reason) {
        return new PermissionDecision(true, reason);
    }

    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, reason);
    }
}
