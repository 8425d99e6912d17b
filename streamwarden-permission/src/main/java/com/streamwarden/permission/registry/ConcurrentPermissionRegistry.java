package com.streamwarden.permission.registry;

import com.streamwarden.permission.PermissionNames;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class ConcurrentPermissionRegistry implements PermissionRegistry {

    private final ConcurrentHashMap<String, RegisteredPermission> permissions = new ConcurrentHashMap<>();

    @Override
    public boolean register(String name, String description, String ownerId) {
        String normalized = PermissionNames.normalize(name);
        RegisteredPermission entry = new RegisteredPermission(normalized,
                Objects.requireNonNullElse(description, ""), ownerId);
        boolean added = permissions.putIfAbsent(normalized, entry) == null;
        if (added) {
            log.debug("Registered permission {} ({})", normalized, ownerId);
        }
        return added;
    }

    @Override
    public Optional<RegisteredPermission> unregister(String name) {
        String normalized = PermissionNames.normalize(name);
        RegisteredPermission removed = permissions.remove(normalized);
        if (removed != null) {
            log.debug("Unregistered permission {}", normalized);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<RegisteredPermission> find(String name) {
        if (PermissionNames.isBlank(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(permissions.get(PermissionNames.normalize(name)));
    }

    @Override
    public boolean isRegistered(String name) {
        return find(name).isPresent();
    }

    @Override
    public Collection<RegisteredPermission> all() {
        return permissions.values().stream()
                .sorted(Comparator.comparing(RegisteredPermission::name))
                .toList();
    }

    @Override
    public Collection<RegisteredPermission> ownedBy(String ownerId) {
        List<RegisteredPermission> owned = permissions.values().stream()
                .filter(p -> Objects.equals(p.ownerId(), ownerId))
                .sorted(Comparator.comparing(RegisteredPermission::name))
                .toList();
        return owned;
    }
}
