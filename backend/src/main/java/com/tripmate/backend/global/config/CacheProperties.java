package com.tripmate.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Redis connection and TTL settings bound from {@code app.cache.*}.
 */
@ConfigurationProperties(prefix = "app.cache")
public record CacheProperties(
        @DefaultValue("redis://localhost:6379") String url,
        @DefaultValue("500ms") Duration commandTimeout,
        @DefaultValue("2s") Duration connectTimeout,
        @DefaultValue("1h") Duration userTtl,
        @DefaultValue("5m") Duration permissionTtl
) {
}
