package com.streamwarden.permission;

import com.streamwarden.permission.actor.InMemoryActorDirectory;
import com.streamwarden.permission.registry.ConcurrentPermissionRegistry;
import com.streamwarden.permission.store.InMemoryPermissionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PermissionServiceTest {

    private static final String CHANNEL = "chan-1";

    private InMemoryPermissionStore store;
    private InMemoryActorDirectory actors;
    private ConcurrentPermissionRegistry registry;
    private PermissionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPermissionStore();
        actors = new InMemoryActorDirectory();
        registry = new ConcurrentPermissionRegistry();
        service = new PermissionService(store, actors, registry);
    }

    @Nested
    class Groups {

        @Test
        void createGroup_sameNameDifferentCase_returnsExisting() {
            PermissionGroup first = service.createGroup(CHANNEL, "Editors");
            PermissionGroup second = service.createGroup(CHANNEL, "editors");

            assertEquals(first.id(), second.id());
            assertEquals("Editors", second.name());
            assertEquals(1, service.listGroups(CHANNEL).size());
        }

        @Test
        void createGroup_sameNameOtherChannel_isIndependent() {
            PermissionGroup a = service.createGroup(CHANNEL, "editors");
            PermissionGroup b = service.createGroup("chan-2", "editors");
            assertNotEquals(a.id(), b.id());
        }

        @Test
        void deleteGroup_unknown_returnsFalse() {
            assertFalse(service.deleteGroup(CHANNEL, "nope"));
        }

        @Test
        void deleteGroup_freesName() {
            PermissionGroup old = service.createGroup(CHANNEL, "editors");
            service.deleteGroup(CHANNEL, "editors");
            PermissionGroup fresh = service.createGroup(CHANNEL, "editors");
            assertNotEquals(old.id(), fresh.id());
        }

        @Test
        void deleteGroup_removesFromEveryMemberInChannel() {
            service.createGroup(CHANNEL, "editors");
            service.createGroup(CHANNEL, "others");
            service.addMembership(CHANNEL, "u1", "editors");
            service.addMembership(CHANNEL, "u2", "editors");
            service.addMembership(CHANNEL, "u2", "others");

            service.deleteGroup(CHANNEL, "editors");

            assertTrue(actors.find(CHANNEL, "u1").orElseThrow().groupMemberships().isEmpty());
            assertEquals(1, actors.find(CHANNEL, "u2").orElseThrow().groupMemberships().size());
        }
    }

    @Nested
    class Entries {

        @Test
        void addPermission_isIdempotentOnName() {
            service.createGroup(CHANNEL, "editors");
            service.addPermission(CHANNEL, "editors", "can_x", false);
            service.addPermission(CHANNEL, "editors", "CAN_X", true);

            List<PermissionEntry> entries = service.findGroup(CHANNEL, "editors").orElseThrow().entries();
            assertEquals(List.of(PermissionEntry.allow("can_x")), entries);
        }

        @Test
        void updatePermission_flipsInPlace() {
            service.createGroup(CHANNEL, "editors");
            service.addPermission(CHANNEL, "editors", "can_a", false);
            service.addPermission(CHANNEL, "editors", "can_b", false);

            service.updatePermission(CHANNEL, "editors", "can_a", true);

            List<PermissionEntry> entries = service.findGroup(CHANNEL, "editors").orElseThrow().entries();
            assertEquals(List.of(PermissionEntry.deny("can_a"), PermissionEntry.allow("can_b")), entries);
        }

        @Test
        void mutations_onMissingGroup_returnFalse() {
            assertFalse(service.addPermission(CHANNEL, "nope", "can_x", false));
            assertFalse(service.updatePermission(CHANNEL, "nope", "can_x", false));
            assertFalse(service.removePermission(CHANNEL, "nope", "can_x"));
            assertFalse(service.addMembership(CHANNEL, "u1", "nope"));
            assertFalse(service.removeMembership(CHANNEL, "u1", "nope"));
        }

        @Test
        void nullOrBlankIdentifiers_areRejected() {
            assertThrows(IllegalArgumentException.class, () -> service.createGroup(CHANNEL, " "));
            assertThrows(IllegalArgumentException.class, () -> service.createGroup(null, "editors"));
            assertThrows(IllegalArgumentException.class, () -> service.addMembership(CHANNEL, "", "editors"));
            assertThrows(IllegalArgumentException.class,
                    () -> service.updatePermission(CHANNEL, "editors", null, true));
            assertThrows(IllegalArgumentException.class, () -> service.unregisterPermission(" "));
        }
    }

    @Nested
    class Registry {

        @Test
        void register_twice_secondFails() {
            assertTrue(service.registerPermission("Can Quote", "quote command", "quotes"));
            assertFalse(service.registerPermission("can_quote", "other", "quotes"));
            assertEquals("quote command", registry.find("CAN QUOTE").orElseThrow().description());
        }

        @Test
        void unregister_cascadesToEveryGroup() {
            service.registerPermission("can_quote", "", "quotes");
            service.createGroup(CHANNEL, "editors");
            service.createGroup("chan-2", "mods");
            service.addPermission(CHANNEL, "editors", "can_quote", false);
            service.addPermission(CHANNEL, "editors", "can_other", false);
            service.addPermission("chan-2", "mods", "can_quote", true);

            assertTrue(service.unregisterPermission("can_quote"));

            assertEquals(List.of(PermissionEntry.allow("can_other")),
                    service.findGroup(CHANNEL, "editors").orElseThrow().entries());
            assertTrue(service.findGroup("chan-2", "mods").orElseThrow().entries().isEmpty());
        }

        @Test
        void unregister_unknownName_leavesGroupsAlone() {
            service.createGroup(CHANNEL, "editors");
            service.addPermission(CHANNEL, "editors", "can_quote", false);

            assertFalse(service.unregisterPermission("can_quote"));
            assertEquals(1, service.findGroup(CHANNEL, "editors").orElseThrow().entries().size());
        }
    }
}
