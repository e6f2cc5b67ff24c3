package com.tripmate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import com.tripmate.backend.support.TestAuthProperties;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String DEV_ACCESS = "change-me-access-secret-0123456789abcdef";
    private static final String DEV_REFRESH = "change-me-refresh-secret-0123456789abcdef";

    @Test
    void validConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment("prod"), TestAuthProperties.defaults());

        assertThat(validator.collectProblems()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void shortAndSharedSecretsAreReported() {
        AuthProperties properties = properties("short", "short", Duration.ofDays(1), Duration.ofDays(7));

        assertThat(new EnvironmentValidator(environment("prod"), properties).collectProblems())
                .anyMatch(problem -> problem.contains("access-secret must be at least 32"))
                .anyMatch(problem -> problem.contains("refresh-secret must be at least 32"))
                .anyMatch(problem -> problem.contains("must differ"));
    }

    @Test
    void developmentSecretsAreOnlyAllowedInRelaxedProfiles() {
        AuthProperties properties = properties(DEV_ACCESS, DEV_REFRESH, Duration.ofDays(1), Duration.ofDays(7));

        assertThat(new EnvironmentValidator(environment("dev"), properties).collectProblems()).isEmpty();
        EnvironmentValidator production = new EnvironmentValidator(environment("prod"), properties);
        assertThat(production.collectProblems()).hasSize(2);
        assertThatThrownBy(production::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("development default");
    }

    @Test
    void refreshTokensMustOutliveAccessTokens() {
        AuthProperties properties = properties(
                TestAuthProperties.ACCESS_SECRET, TestAuthProperties.REFRESH_SECRET, Duration.ofDays(1), Duration.ofHours(12));

        assertThat(new EnvironmentValidator(environment("prod"), properties).collectProblems())
                .containsExactly("app.auth.refresh-token-ttl must be longer than the access-token TTL");
    }

    private static MockEnvironment environment(String profile) {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles(profile);
        return environment;
    }

    private static AuthProperties properties(String access, String refresh, Duration accessTtl, Duration refreshTtl) {
        return new AuthProperties(access, refresh, accessTtl, refreshTtl, 10, Duration.ofHours(1), Duration.ofHours(24));
    }
}
