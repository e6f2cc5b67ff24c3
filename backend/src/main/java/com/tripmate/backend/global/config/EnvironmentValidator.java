package com.tripmate.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Refuses to run with signing configuration that would silently weaken token security.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_LENGTH = 32;
    private static final String DEV_SECRET_MARKER = "change-me";
    private static final List<String> RELAXED_PROFILES = List.of("dev", "local", "test");

    private final Environment environment;
    private final AuthProperties authProperties;

    public EnvironmentValidator(Environment environment, AuthProperties authProperties) {
        this.environment = environment;
        this.authProperties = authProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid auth configuration: " + String.join("; ", problems));
        }
        log.info("Auth configuration validated (access TTL {}, refresh TTL {})",
                authProperties.accessTokenTtl(), authProperties.refreshTokenTtl());
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        String accessSecret = authProperties.accessSecret();
        String refreshSecret = authProperties.refreshSecret();

        if (!StringUtils.hasText(accessSecret)) {
            problems.add("app.auth.access-secret is required");
        } else if (accessSecret.length() < MIN_SECRET_LENGTH) {
            problems.add("app.auth.access-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (!StringUtils.hasText(refreshSecret)) {
            problems.add("app.auth.refresh-secret is required");
        } else if (refreshSecret.length() < MIN_SECRET_LENGTH) {
            problems.add("app.auth.refresh-secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        if (StringUtils.hasText(accessSecret) && accessSecret.equals(refreshSecret)) {
            problems.add("access and refresh secrets must differ");
        }
        if (!isRelaxedProfile()) {
            if (accessSecret != null && accessSecret.contains(DEV_SECRET_MARKER)) {
                problems.add("app.auth.access-secret still uses the development default");
            }
            if (refreshSecret != null && refreshSecret.contains(DEV_SECRET_MARKER)) {
                problems.add("app.auth.refresh-secret still uses the development default");
            }
        }

        Duration accessTtl = authProperties.accessTokenTtl();
        Duration refreshTtl = authProperties.refreshTokenTtl();
        if (accessTtl.compareTo(Duration.ofMinutes(1)) < 0 || accessTtl.compareTo(Duration.ofDays(7)) > 0) {
            problems.add("app.auth.access-token-ttl must be between 1 minute and 7 days");
        }
        if (refreshTtl.compareTo(accessTtl) <= 0) {
            problems.add("app.auth.refresh-token-ttl must be longer than the access-token TTL");
        }
        return problems;
    }

    private boolean isRelaxedProfile() {
        return Arrays.stream(environment.getActiveProfiles()).anyMatch(RELAXED_PROFILES::contains);
    }
}
