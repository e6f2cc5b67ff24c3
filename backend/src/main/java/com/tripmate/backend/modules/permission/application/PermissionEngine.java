package com.tripmate.backend.modules.permission.application;

import java.util.UUID;

import com.tripmate.backend.modules.permission.domain.PermissionObject;

/**
 * Source of truth for relationship-based authorization. Results are cached one level up by
 * {@link PermissionService}.
 */
public interface PermissionEngine {

    boolean check(UUID userId, String relation, PermissionObject object);

    boolean checkSuperAdmin(UUID userId);

    void assignSuperAdmin(UUID userId);

    void removeSuperAdmin(UUID userId);

    /**
     * Makes the user owner of their profile object.
     */
    void createProfileRelations(UUID userId, UUID profileId);

    void deleteAllRelations(UUID userId);
}
