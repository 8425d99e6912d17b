package com.streamwarden.permission.registry;

/**
 * A permission name a plugin gates a feature behind.
 */
public record RegisteredPermission(String name, String description, String ownerId) {
}
