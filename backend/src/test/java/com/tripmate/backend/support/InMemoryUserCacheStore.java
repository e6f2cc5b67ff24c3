package com.tripmate.backend.support;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.tripmate.backend.modules.auth.application.CachedUser;
import com.tripmate.backend.modules.auth.application.UserCacheStore;

public class InMemoryUserCacheStore implements UserCacheStore {

    private final Map<UUID, CachedUser> byId = new HashMap<>();
    private final Map<String, CachedUser> byEmail = new HashMap<>();

    @Override
    public void cache(CachedUser user) {
        byId.put(user.id(), user);
        if (user.email() != null) {
            byEmail.put(user.email().toLowerCase(Locale.ROOT), user);
        }
    }

    @Override
    public Optional<CachedUser> findById(UUID userId) {
        return Optional.ofNullable(byId.get(userId));
    }

    @Override
    public Optional<CachedUser> findByEmail(String email) {
        return Optional.ofNullable(byEmail.get(email.toLowerCase(Locale.ROOT)));
    }

    @Override
    public void invalidate(UUID userId, String email) {
        byId.remove(userId);
        if (email != null) {
            byEmail.remove(email.toLowerCase(Locale.ROOT));
        }
    }
}
