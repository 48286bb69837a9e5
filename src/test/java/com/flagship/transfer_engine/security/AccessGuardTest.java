package com.flagship.transfer_engine.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AccessGuardTest {

    private final AccessGuard accessGuard = new AccessGuard();

    private Principal principal(Role role) {
        return new Principal(UUID.randomUUID(), role);
    }

    @ParameterizedTest
    @CsvSource({
        // role,       initiate, approve, viewTransfers, viewAudit
        "CONTROLLER,   true,     false,   true,          false",
        "ADMIN,        true,     true,    true,          true",
        "AUDIT,        false,    false,   true,          true",
        "NONE,         false,    false,   false,         false"
    })
    @DisplayName("Role capabilities")
    void roleCapabilities(Role role, boolean initiate, boolean approve, boolean viewTransfers, boolean viewAudit) {
        assertEquals(initiate, role.canInitiateTransfers());
        assertEquals(approve, role.canApproveTransfers());
        assertEquals(viewTransfers, role.canViewTransfers());
        assertEquals(viewAudit, role.canViewAuditTrail());
    }

    @Test
    @DisplayName("Only ADMIN may approve")
    void onlyAdminApproves() {
        assertDoesNotThrow(() -> accessGuard.requireApprove(principal(Role.ADMIN)));

        AccessDeniedException e = assertThrows(AccessDeniedException.class,
                () -> accessGuard.requireApprove(principal(Role.CONTROLLER)));
        assertEquals("Forbidden: insufficient permissions to approve transfers", e.getMessage());
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = {"AUDIT", "NONE"})
    @DisplayName("Roles without initiate capability are refused")
    void initiateRefused(Role role) {
        assertThrows(AccessDeniedException.class, () -> accessGuard.requireInitiate(principal(role)));
    }

    @Test
    @DisplayName("CONTROLLER cannot read the audit log")
    void controllerCannotReadAudit() {
        assertThrows(AccessDeniedException.class, () -> accessGuard.requireViewAuditTrail(principal(Role.CONTROLLER)));
    }

    @Test
    @DisplayName("Role names resolve case-insensitively; unknown names carry no capabilities")
    void roleNames() {
        assertEquals(Role.ADMIN, Role.fromName(" admin "));
        assertEquals(Role.NONE, Role.fromName("superuser"));
        assertEquals(Role.NONE, Role.fromName(null));
    }

    @Test
    @DisplayName("Principal headers: id is required and must be a UUID")
    void principalHeaders() {
        UUID id = UUID.randomUUID();

        Principal principal = Principal.fromHeaders(id.toString(), "CONTROLLER");
        assertEquals(id, principal.getId());
        assertEquals(Role.CONTROLLER, principal.getRole());

        assertThrows(AuthenticationRequiredException.class, () -> Principal.fromHeaders(null, "ADMIN"));
        assertThrows(AuthenticationRequiredException.class, () -> Principal.fromHeaders("not-a-uuid", "ADMIN"));
    }
}
