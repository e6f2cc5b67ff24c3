package com.tripmate.backend.health;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness ({@code /healthz}) and readiness ({@code /readyz}, database and Redis) checks.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final List<String> READINESS_COMPONENTS = List.of("db", "redis");

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), OffsetDateTime.now(clock).toString(), Map.of());
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        Map<String, String> components = new LinkedHashMap<>();
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = Status.UP.getCode();
            if (health instanceof CompositeHealth composite) {
                for (String name : READINESS_COMPONENTS) {
                    HealthComponent component = composite.getComponents().get(name);
                    String code = component != null ? component.getStatus().getCode() : Status.UNKNOWN.getCode();
                    components.put(name, code);
                    if (component != null && !Status.UP.equals(component.getStatus())) {
                        status = Status.DOWN.getCode();
                    }
                }
            } else {
                status = health.getStatus().getCode();
            }
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed: {}", ex.getMessage());
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus)
                .body(new HealthResponse(status, OffsetDateTime.now(clock).toString(), components));
    }

    public record HealthResponse(
            String status,
            String timestamp,
            Map<String, String> components
    ) {
    }
}
