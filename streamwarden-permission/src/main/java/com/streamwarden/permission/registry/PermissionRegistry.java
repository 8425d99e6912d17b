package com.streamwarden.permission.registry;

import java.util.Collection;
import java.util.Optional;

/**
 * Process-wide catalogue of permission names. Advisory only: groups may
 * reference names that are not registered, and the resolver never reads it.
 * Reads must not block on concurrent registration.
 */
public interface PermissionRegistry {

    /**
     * @return false if the name was already registered
     */
    boolean register(String name, String description, String ownerId);

    /**
     * @return the removed registration, if any
     */
    Optional<RegisteredPermission> unregister(String name);

    Optional<RegisteredPermission> find(String name);

    boolean isRegistered(String name);

    Collection<RegisteredPermission> all();

    /** Names registered by one owner, typically a plugin id. */
    Collection<RegisteredPermission> ownedBy(String ownerId);
}
