package com.streamwarden.permission.registry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentPermissionRegistryTest {

    private final ConcurrentPermissionRegistry registry = new ConcurrentPermissionRegistry();

    @Test
    void register_normalizesName() {
        assertTrue(registry.register("  Can Permit ", "Permit links", "permit"));

        RegisteredPermission found = registry.find("can_permit").orElseThrow();
        assertEquals("can_permit", found.name());
        assertEquals("Permit links", found.description());
        assertTrue(registry.isRegistered("CAN_PERMIT"));
    }

    @Test
    void register_takenName_keepsFirstOwner() {
        registry.register("can_permit", "first", "a");
        assertFalse(registry.register("can_permit", "second", "b"));
        assertEquals("a", registry.find("can_permit").orElseThrow().ownerId());
    }

    @Test
    void register_blankName_throws() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", "x", "a"));
    }

    @Test
    void find_blank_isEmpty() {
        assertTrue(registry.find(null).isEmpty());
        assertTrue(registry.find("").isEmpty());
    }

    @Test
    void ownedBy_filtersAndSorts() {
        registry.register("can_b", null, "mod");
        registry.register("can_a", null, "mod");
        registry.register("can_c", null, "other");

        assertEquals(List.of("can_a", "can_b"), registry.ownedBy("mod").stream().map(RegisteredPermission::name).toList());
        assertEquals("", registry.find("can_a").orElseThrow().description());
        assertEquals(3, registry.all().size());
    }

    @Test
    void unregister_returnsRemovedEntry() {
        registry.register("can_permit", "x", "permit");

        assertEquals("permit", registry.unregister("Can Permit").orElseThrow().ownerId());
        assertTrue(registry.unregister("can_permit").isEmpty());
        assertFalse(registry.isRegistered("can_permit"));
    }
}
