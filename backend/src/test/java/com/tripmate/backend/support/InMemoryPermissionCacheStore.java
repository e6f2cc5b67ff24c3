package com.tripmate.backend.support;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.permission.application.CachedPermission;
import com.tripmate.backend.modules.permission.application.PermissionCacheStore;
import com.tripmate.backend.modules.permission.application.PermissionCheck;
import com.tripmate.backend.modules.permission.domain.PermissionObject;

public class InMemoryPermissionCacheStore implements PermissionCacheStore {

    private final Map<String, CachedPermission> entries = new HashMap<>();

    @Override
    public void cache(UUID userId, PermissionObject object, String relation, boolean allowed) {
        entries.put(key(userId, object, relation), new CachedPermission(allowed, OffsetDateTime.now(ZoneOffset.UTC)));
    }

    @Override
    public Optional<CachedPermission> get(UUID userId, PermissionObject object, String relation) {
        return Optional.ofNullable(entries.get(key(userId, object, relation)));
    }

    @Override
    public void invalidateAllForUser(UUID userId) {
        String prefix = "perm:" + userId + ":";
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }

    @Override
    public void cacheBatch(UUID userId, Map<PermissionCheck, Boolean> results) {
        results.forEach((check, allowed) -> cache(userId, check.object(), check.relation(), allowed));
    }

    public int size() {
        return entries.size();
    }

    private static String key(UUID userId, PermissionObject object, String relation) {
        return "perm:" + userId + ":" + object + ":" + relation;
    }
}
