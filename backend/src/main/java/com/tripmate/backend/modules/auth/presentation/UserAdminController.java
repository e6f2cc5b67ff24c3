package com.tripmate.backend.modules.auth.presentation;

import java.util.List;
import java.util.UUID;

import com.tripmate.backend.global.security.AuthenticatedPrincipal;
import com.tripmate.backend.global.security.PermissionGuard;
import com.tripmate.backend.global.security.SecurityUtils;
import com.tripmate.backend.global.web.ApiResponse;
import com.tripmate.backend.modules.auth.application.UserAdministrationService;
import com.tripmate.backend.modules.auth.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "Superadmin and session administration")
@SecurityRequirement(name = "bearerAuth")
public class UserAdminController {

    private final UserAdministrationService userAdministrationService;
    private final PermissionGuard permissionGuard;

    public UserAdminController(UserAdministrationService userAdministrationService, PermissionGuard permissionGuard) {
        this.userAdministrationService = userAdministrationService;
        this.permissionGuard = permissionGuard;
    }

    @PostMapping("/{userId}/superadmin")
    @Operation(summary = "Grant superadmin")
    public ResponseEntity<ApiResponse<Void>> assignSuperAdmin(@PathVariable UUID userId) {
        permissionGuard.requireSuperAdmin(SecurityUtils.getCurrentPrincipal());
        userAdministrationService.assignSuperAdmin(userId);
        return ResponseEntity.ok(ApiResponse.ok("Superadmin role assigned successfully"));
    }

    @DeleteMapping("/{userId}/superadmin")
    @Operation(summary = "Revoke superadmin")
    public ResponseEntity<ApiResponse<Void>> removeSuperAdmin(@PathVariable UUID userId) {
        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        permissionGuard.requireSuperAdmin(principal);
        userAdministrationService.removeSuperAdmin(principal, userId);
        return ResponseEntity.ok(ApiResponse.ok("Superadmin role removed successfully"));
    }

    @GetMapping("/{userId}/sessions")
    @Operation(summary = "List active sessions")
    public ResponseEntity<ApiResponse<List<SessionResponse>>> listSessions(@PathVariable UUID userId) {
        permissionGuard.requireSelfOrSuperAdmin(SecurityUtils.getCurrentPrincipal(), userId);
        return ResponseEntity.ok(ApiResponse.ok("Active sessions", userAdministrationService.listSessions(userId)));
    }

    @DeleteMapping("/{userId}/sessions")
    @Operation(summary = "Revoke every session")
    public ResponseEntity<ApiResponse<Void>> revokeSessions(@PathVariable UUID userId) {
        permissionGuard.requireSelfOrSuperAdmin(SecurityUtils.getCurrentPrincipal(), userId);
        userAdministrationService.revokeSessions(userId);
        return ResponseEntity.ok(ApiResponse.ok("All sessions revoked"));
    }

    @DeleteMapping("/{userId}/sessions/{sessionId}")
    @Operation(summary = "Revoke one session")
    public ResponseEntity<ApiResponse<Void>> revokeSession(@PathVariable UUID userId, @PathVariable String sessionId) {
        permissionGuard.requireSelfOrSuperAdmin(SecurityUtils.getCurrentPrincipal(), userId);
        userAdministrationService.revokeSession(userId, sessionId);
        return ResponseEntity.ok(ApiResponse.ok("Session revoked successfully"));
    }

    @DeleteMapping("/{userId}")
    @Operation(summary = "Delete a user and everything cached about them")
    public ResponseEntity<ApiResponse<Void>> deleteUser(@PathVariable UUID userId) {
        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        permissionGuard.requireSuperAdmin(principal);
        userAdministrationService.deleteUser(principal, userId);
        return ResponseEntity.ok(ApiResponse.ok("User deleted successfully"));
    }
}
