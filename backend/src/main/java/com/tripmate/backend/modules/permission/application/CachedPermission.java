package com.tripmate.backend.modules.permission.application;

import java.time.OffsetDateTime;

public record CachedPermission(boolean allowed, OffsetDateTime timestamp) {
}
