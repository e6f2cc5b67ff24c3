package com.tripmate.backend.modules.permission.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.tripmate.backend.modules.permission.domain.PermissionObject;
import com.tripmate.backend.modules.permission.domain.Relations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cached front for the {@link PermissionEngine}. Writes go to the engine first and then drop
 * the user's cached results.
 */
@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final PermissionEngine permissionEngine;
    private final PermissionCacheStore permissionCacheStore;

    public PermissionService(PermissionEngine permissionEngine, PermissionCacheStore permissionCacheStore) {
        this.permissionEngine = permissionEngine;
        this.permissionCacheStore = permissionCacheStore;
    }

    public boolean hasPermission(UUID userId, String objectType, String objectId, String relation) {
        PermissionObject object = PermissionObject.of(objectType, objectId);
        return permissionCacheStore.get(userId, object, relation)
                .map(CachedPermission::allowed)
                .orElseGet(() -> {
                    boolean allowed = permissionEngine.check(userId, relation, object);
                    permissionCacheStore.cache(userId, object, relation, allowed);
                    return allowed;
                });
    }

    public boolean isSuperAdmin(UUID userId) {
        PermissionObject object = PermissionObject.SUPERADMIN;
        return permissionCacheStore.get(userId, object, Relations.CAN_MANAGE_ALL)
                .map(CachedPermission::allowed)
                .orElseGet(() -> {
                    boolean allowed = permissionEngine.checkSuperAdmin(userId);
                    permissionCacheStore.cache(userId, object, Relations.CAN_MANAGE_ALL, allowed);
                    return allowed;
                });
    }

    /**
     * Evaluates several checks, asking the engine only for the ones not already cached.
     */
    public Map<PermissionCheck, Boolean> checkAll(UUID userId, List<PermissionCheck> checks) {
        Map<PermissionCheck, Boolean> results = new LinkedHashMap<>();
        Map<PermissionCheck, Boolean> fresh = new LinkedHashMap<>();
        for (PermissionCheck check : checks) {
            var cached = permissionCacheStore.get(userId, check.object(), check.relation());
            if (cached.isPresent()) {
                results.put(check, cached.get().allowed());
            } else {
                boolean allowed = permissionEngine.check(userId, check.relation(), check.object());
                results.put(check, allowed);
                fresh.put(check, allowed);
            }
        }
        if (!fresh.isEmpty()) {
            permissionCacheStore.cacheBatch(userId, fresh);
        }
        return results;
    }

    public void grantSuperAdmin(UUID userId) {
        permissionEngine.assignSuperAdmin(userId);
        invalidateAllUserPermissions(userId);
    }

    public void revokeSuperAdmin(UUID userId) {
        permissionEngine.removeSuperAdmin(userId);
        invalidateAllUserPermissions(userId);
    }

    public void createProfileRelations(UUID userId, UUID profileId) {
        permissionEngine.createProfileRelations(userId, profileId);
    }

    public void deleteAllRelations(UUID userId) {
        permissionEngine.deleteAllRelations(userId);
        invalidateAllUserPermissions(userId);
    }

    public void invalidateAllUserPermissions(UUID userId) {
        permissionCacheStore.invalidateAllForUser(userId);
        log.debug("Invalidated cached permissions of {}", userId);
    }
}
