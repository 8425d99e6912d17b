package com.streamwarden.permission;

import com.streamwarden.common.level.UserLevel;
import com.streamwarden.common.level.UserLevels;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BadgeLevelParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "staff/1,broadcaster/1;TWITCH_STAFF",
            "broadcaster/1,admin/1;TWITCH_ADMIN",
            "subscriber/12,broadcaster/1;BROADCASTER",
            "vip/1,moderator/1;MODERATOR",
            "vip/1,subscriber/3000;SUBSCRIBER",
            "vip/1;VIP",
            "premium/1,glhf-pledge/1;VIEWER"
    })
    void parseTag_highestBadgeWins(String tag, UserLevel expected) {
        assertEquals(UserLevels.of(expected), BadgeLevelParser.parseTag(tag));
    }

    @Test
    void noBadges_isViewer() {
        assertEquals(UserLevels.VIEWER, BadgeLevelParser.parseTag(""));
        assertEquals(UserLevels.VIEWER, BadgeLevelParser.parse(Map.of()));
        assertEquals(UserLevels.VIEWER, BadgeLevelParser.parse(null));
    }

    @Test
    void commandPermissionName_joinsCommandAndArgs() {
        assertEquals("can_permit", CommandPermissions.permissionNameFor("Permit"));
        assertEquals("can_permissions_group_create",
                CommandPermissions.permissionNameFor("permissions", List.of("group", "create", "x"), 2));
        assertEquals("can_quote_edit_tags", PermissionNames.normalize("  Can Quote\tEdit  Tags "));
    }
}
