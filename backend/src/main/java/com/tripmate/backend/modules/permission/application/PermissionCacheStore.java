package com.tripmate.backend.modules.permission.application;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.permission.domain.PermissionObject;

/**
 * Soft cache of permission results. A miss or a read failure is reported as empty and the
 * caller asks the {@link PermissionEngine}.
 */
public interface PermissionCacheStore {

    void cache(UUID userId, PermissionObject object, String relation, boolean allowed);

    Optional<CachedPermission> get(UUID userId, PermissionObject object, String relation);

    void invalidateAllForUser(UUID userId);

    void cacheBatch(UUID userId, Map<PermissionCheck, Boolean> results);
}
