package com.streamwarden.app.commands;

import com.streamwarden.app.WardenFixture;
import com.streamwarden.common.level.UserLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.streamwarden.app.WardenFixture.CHANNEL;
import static org.junit.jupiter.api.Assertions.*;

class PermissionCommandsTest {

    private static final String OWNER = "9";

    private WardenFixture fx;

    @BeforeEach
    void setUp() {
        fx = new WardenFixture().loadBuiltInCommands();
        fx.user(OWNER, UserLevel.BROADCASTER);
    }

    private String owner(String text) {
        return fx.run(OWNER, text).text();
    }

    @Test
    void noArguments_showsUsage() {
        assertEquals("@user9, manages custom permissions. Usage: !permissions [group, user]", owner("!permissions"));
        assertEquals("@user9, usage: !permissions group [create, delete, list, allow, deny, inherit, listpermissions]",
                owner("!permissions group"));
    }

    @Test
    void registersPermissionNamesUnderPluginId() {
        assertTrue(fx.permissionRegistry.isRegistered("can_permissions_group"));
        assertEquals("permissions", fx.permissionRegistry.find("can_permissions_user").orElseThrow().ownerId());
    }

    // =========================================================================
    // group
    // =========================================================================

    @Nested
    class Group {

        @Test
        void create_keepsSpacesInName() {
            assertEquals("@user9, the permission group Trusted Regulars has been created.",
                    owner("!permissions group create Trusted Regulars"));
            assertTrue(fx.permissionService.findGroup(CHANNEL, "trusted regulars").isPresent());
        }

        @Test
        void create_existingName_isReported() {
            owner("!permissions group create Editors");
            assertEquals("@user9, the permission group editors already exists.",
                    owner("!permissions group create editors"));
            assertEquals(1, fx.permissionService.listGroups(CHANNEL).size());
        }

        @Test
        void delete_unknown_isReported() {
            assertEquals("@user9, there is no permission group named Ghosts.", owner("!permissions group delete Ghosts"));
        }

        @Test
        void delete_removesGroup() {
            owner("!permissions group create Editors");
            assertEquals("@user9, the permission group Editors has been deleted.",
                    owner("!permissions group remove Editors"));
            assertTrue(fx.permissionService.listGroups(CHANNEL).isEmpty());
        }

        @Test
        void list_isSortedCaseInsensitively() {
            owner("!permissions group create beta");
            owner("!permissions group create Alpha");
            assertEquals("@user9, permission groups [page 1 of 1]: Alpha, beta", owner("!permissions group list"));
        }

        @Test
        void list_empty() {
            assertEquals("@user9, this channel has no permission groups.", owner("!permissions group list"));
        }

        @Test
        void allowDenyInherit_areListed() {
            owner("!permissions group create Editors");
            assertEquals("@user9, the permission can_permit has been allowed to members of Editors.",
                    owner("!permissions group allow can_permit Editors"));
            assertEquals("@user9, the permission can_moderation_status has been explicitly denied to members of Editors.",
                    owner("!permissions group deny can_moderation_status Editors"));

            assertEquals("@user9, permissions of group Editors [page 1 of 1]: can_permit, can_moderation_status (Denied)",
                    owner("!permissions group listpermissions Editors"));

            assertEquals("@user9, members of Editors now inherit the permission can_permit.",
                    owner("!permissions group inherit can_permit Editors"));
            assertEquals("@user9, permissions of group Editors [page 1 of 1]: can_moderation_status (Denied)",
                    owner("!permissions group permissions 1 Editors"));
        }

        @Test
        void allow_flipsExistingDenyInPlace() {
            owner("!permissions group create Editors");
            owner("!permissions group deny can_permit Editors");
            owner("!permissions group allow can_permit Editors");

            assertEquals(1, fx.permissionService.findGroup(CHANNEL, "Editors").orElseThrow().entries().size());
            assertTrue(fx.permissionService.findGroup(CHANNEL, "Editors").orElseThrow().allows("can_permit"));
        }

        @Test
        void listPermissions_noEntries() {
            owner("!permissions group create Editors");
            assertEquals("@user9, the group Editors has no permissions set.",
                    owner("!permissions group listpermissions Editors"));
        }

        @Test
        void allow_missingArguments_showsUsage() {
            assertEquals("@user9, usage: !permissions group allow (PermissionName) (GroupName)",
                    owner("!permissions group allow can_permit"));
        }
    }

    // =========================================================================
    // user
    // =========================================================================

    @Nested
    class User {

        @Test
        void add_grantsGroupPermissions() {
            owner("!permissions group create Link Posters");
            owner("!permissions group allow can_permit Link Posters");
            assertEquals("@user9, user 5 has been added to Link Posters.",
                    owner("!permissions user add 5 Link Posters"));

            fx.user("5", UserLevel.VIEWER);
            assertEquals("@user5, user 6 may post links for the next 60 seconds.", fx.run("5", "!permit 6").text());
        }

        @Test
        void add_unknownGroup_isReported() {
            assertEquals("@user9, there is no permission group named Nobody.", owner("!permissions user add 5 Nobody"));
        }

        @Test
        void remove_notMember_isReported() {
            owner("!permissions group create Editors");
            assertEquals("@user9, user 5 is not a member of Editors.", owner("!permissions user remove 5 Editors"));
        }

        @Test
        void remove_revokesGroupPermissions() {
            owner("!permissions group create Editors");
            owner("!permissions group allow can_permit Editors");
            owner("!permissions user add 5 Editors");
            assertEquals("@user9, user 5 has been removed from Editors.", owner("!permissions user remove 5 Editors"));

            assertTrue(fx.run("5", "!permit 6").text().contains("do not have permission"));
        }

        @Test
        void badAction_showsUsage() {
            assertEquals("@user9, usage: !permissions user [add, remove] (UserId) (GroupName)",
                    owner("!permissions user promote 5 Editors"));
        }
    }

    // =========================================================================
    // Gating
    // =========================================================================

    @Nested
    class Gating {

        @Test
        void moderator_isDeniedByDefault() {
            fx.user("2", UserLevel.MODERATOR);
            assertEquals("@user2, you do not have permission to use !permissions.",
                    fx.run("2", "!permissions group create Editors").text());
        }

        @Test
        void groupSubcommandGrant_doesNotCoverUserSubcommand() {
            fx.user("2", UserLevel.MODERATOR);
            owner("!permissions group create Managers");
            owner("!permissions group allow can_permissions_group Managers");
            owner("!permissions user add 2 Managers");

            assertEquals("@user2, the permission group Editors has been created.",
                    fx.run("2", "!permissions group create Editors").text());
            assertTrue(fx.run("2", "!permissions user add 2 Editors").text().contains("do not have permission"));
        }
    }
}
