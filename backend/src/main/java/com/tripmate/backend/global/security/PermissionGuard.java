package com.tripmate.backend.global.security;

import java.util.UUID;

import com.tripmate.backend.global.error.ErrorCode;
import com.tripmate.backend.global.error.ProblemException;
import com.tripmate.backend.modules.permission.application.PermissionService;

import org.springframework.stereotype.Component;

/**
 * Imperative authorization checks for controllers. Superadmins pass every check.
 */
@Component
public class PermissionGuard {

    private final PermissionService permissionService;

    public PermissionGuard(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    public void requirePermission(AuthenticatedPrincipal principal, String objectType, String objectId, String relation) {
        if (objectId == null || objectId.isBlank()) {
            throw new ProblemException(ErrorCode.BAD_REQUEST, "Resource id is required");
        }
        requireAuthenticated(principal);
        if (principal.superAdmin()) {
            return;
        }
        if (!permissionService.hasPermission(principal.userId(), objectType, objectId, relation)) {
            throw new ProblemException(ErrorCode.FORBIDDEN);
        }
    }

    public void requireSuperAdmin(AuthenticatedPrincipal principal) {
        requireAuthenticated(principal);
        if (!principal.superAdmin()) {
            throw new ProblemException(ErrorCode.FORBIDDEN, "Superadmin privileges required");
        }
    }

    public void requireSelfOrSuperAdmin(AuthenticatedPrincipal principal, UUID userId) {
        requireAuthenticated(principal);
        if (!principal.superAdmin() && !principal.userId().equals(userId)) {
            throw new ProblemException(ErrorCode.FORBIDDEN);
        }
    }

    private static void requireAuthenticated(AuthenticatedPrincipal principal) {
        if (principal == null) {
            throw new ProblemException(ErrorCode.UNAUTHENTICATED);
        }
    }
}
