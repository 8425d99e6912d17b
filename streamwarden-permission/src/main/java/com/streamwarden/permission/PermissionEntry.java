package com.streamwarden.permission;

/**
 * One allow or deny line in a permission group. A name absent from the group
 * means "inherit".
 */
public record PermissionEntry(String permissionName, boolean denied) {

    public PermissionEntry {
        permissionName = PermissionNames.normalize(permissionName);
    }

    public static PermissionEntry allow(String permissionName) {
        return new PermissionEntry(permissionName, false);
    }

    public static PermissionEntry deny(String permissionName) {
        return new PermissionEntry(permissionName, true);
    }
}
