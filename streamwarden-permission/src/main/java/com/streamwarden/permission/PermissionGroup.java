package com.streamwarden.permission;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A named, per-channel set of permission entries. Immutable; the {@code with*}
 * methods return modified copies and are meant to be applied through
 * {@link com.streamwarden.permission.store.PermissionStore#update}.
 */
public record PermissionGroup(String id, String channelId, String name, List<PermissionEntry> entries) {

    public PermissionGroup {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("group id required");
        }
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("group name required");
        }
        name = name.trim();
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /** Lookup key for case-insensitive name uniqueness within a channel. */
    public static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<PermissionEntry> entry(String permissionName) {
        String normalized = PermissionNames.normalize(permissionName);
        return entries.stream()
                .filter(e -> e.permissionName().equals(normalized))
                .findFirst();
    }

    public boolean allows(String normalizedName) {
        return entries.stream().anyMatch(e -> !e.denied() && e.permissionName().equals(normalizedName));
    }

    public boolean denies(String normalizedName) {
        return entries.stream().anyMatch(e -> e.denied() && e.permissionName().equals(normalizedName));
    }

    /**
     * Add the entry, or flip {@code denied} in place when the name is already
     * present. Returns {@code this} when nothing changes.
     */
    public PermissionGroup withEntry(String permissionName, boolean denied) {
        PermissionEntry wanted = new PermissionEntry(permissionName, denied);
        List<PermissionEntry> next = new ArrayList<>(entries.size() + 1);
        boolean found = false;
        for (PermissionEntry e : entries) {
            if (e.permissionName().equals(wanted.permissionName())) {
                if (e.denied() == denied) {
                    return this;
                }
                next.add(wanted);
                found = true;
            } else {
                next.add(e);
            }
        }
        if (!found) {
            next.add(wanted);
        }
        return new PermissionGroup(id, channelId, name, next);
    }

    /**
     * Drop the entry so the permission falls back to inherit.
     */
    public PermissionGroup withoutEntry(String permissionName) {
        String normalized = PermissionNames.normalize(permissionName);
        List<PermissionEntry> next = entries.stream()
                .filter(e -> !e.permissionName().equals(normalized))
                .toList();
        return next.size() == entries.size() ? this : new PermissionGroup(id, channelId, name, next);
    }
}
