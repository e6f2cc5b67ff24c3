package com.tripmate.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Shared infrastructure beans: the UTC clock every module reads time from, the random source for
 * opaque tokens, and the typed property records.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({
        AuthProperties.class,
        CacheProperties.class,
        RateLimitProperties.class,
        SuperAdminBootstrapProperties.class
})
public class AppConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
