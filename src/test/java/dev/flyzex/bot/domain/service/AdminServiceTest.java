package dev.flyzex.bot.domain.service;

import dev.flyzex.bot.domain.model.AdminProfile;
import dev.flyzex.bot.testsupport.TestStateStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdminServiceTest {

    @TempDir
    Path tempDir;

    private AdminService service;

    @BeforeEach
    void setUp() {
        service = new AdminService(TestStateStores.create(tempDir));
    }

    @Test
    void shouldAddAdminWithProfile() {
        assertTrue(service.addAdmin(10L, " mod ", "Moderator One"));

        assertTrue(service.isAdmin(10L));
        AdminProfile profile = service.getAdminDetails().get(0);
        assertEquals(10L, profile.getUserId());
        assertEquals("mod", profile.getUsername());
        assertEquals("Moderator One", profile.getFullName());
    }

    @Test
    void shouldReportNoChangeForIdenticalReAdd() {
        service.addAdmin(10L, "mod", "Moderator One");

        assertFalse(service.addAdmin(10L, "mod", "Moderator One"));
        assertFalse(service.addAdmin(10L, null, "  "));
        assertEquals(List.of(10L), service.listAdmins());
    }

    @Test
    void shouldMergeProfileWithoutErasingKnownFields() {
        service.addAdmin(10L, "mod", "Moderator One");

        assertTrue(service.addAdmin(10L, null, "Moderator Renamed"));

        AdminProfile profile = service.getAdminDetails().get(0);
        assertEquals("mod", profile.getUsername());
        assertEquals("Moderator Renamed", profile.getFullName());
    }

    @Test
    void shouldListIdOnlyProfileWhenNoMetadataIsKnown() {
        service.addAdmin(20L, null, null);
        service.addAdmin(10L, "mod", null);

        List<AdminProfile> details = service.getAdminDetails();

        assertEquals(List.of(20L, 10L), details.stream().map(AdminProfile::getUserId).toList());
        assertNull(details.get(0).getUsername());
        assertNull(details.get(0).getFullName());
    }

    @Test
    void shouldRemoveAdminAndProfile() {
        service.addAdmin(10L, "mod", "Moderator One");

        assertTrue(service.removeAdmin(10L));
        assertFalse(service.removeAdmin(10L));

        assertFalse(service.isAdmin(10L));
        assertTrue(service.getAdminDetails().isEmpty());
        assertTrue(service.addAdmin(10L, null, null));
        assertNull(service.getAdminDetails().get(0).getUsername());
    }
}
