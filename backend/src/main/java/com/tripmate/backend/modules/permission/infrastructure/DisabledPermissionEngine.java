package com.tripmate.backend.modules.permission.infrastructure;

import java.util.UUID;

import com.tripmate.backend.modules.permission.application.PermissionEngine;
import com.tripmate.backend.modules.permission.domain.PermissionObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when {@code app.permissions.enabled=false}. Every check is denied and writes are ignored.
 */
public class DisabledPermissionEngine implements PermissionEngine {

    private static final Logger log = LoggerFactory.getLogger(DisabledPermissionEngine.class);

    @Override
    public boolean check(UUID userId, String relation, PermissionObject object) {
        log.debug("Permission engine disabled, denying {} on {} for {}", relation, object, userId);
        return false;
    }

    @Override
    public boolean checkSuperAdmin(UUID userId) {
        return false;
    }

    @Override
    public void assignSuperAdmin(UUID userId) {
        log.warn("Permission engine disabled, ignoring superadmin assignment for {}", userId);
    }

    @Override
    public void removeSuperAdmin(UUID userId) {
        log.warn("Permission engine disabled, ignoring superadmin removal for {}", userId);
    }

    @Override
    public void createProfileRelations(UUID userId, UUID profileId) {
        log.debug("Permission engine disabled, skipping profile relations for {}", userId);
    }

    @Override
    public void deleteAllRelations(UUID userId) {
        log.debug("Permission engine disabled, skipping relation cleanup for {}", userId);
    }
}
