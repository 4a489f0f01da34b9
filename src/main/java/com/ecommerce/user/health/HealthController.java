package com.ecommerce.user.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness checks.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "user-service";

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public ServiceHealthResponse health() {
        return new ServiceHealthResponse("healthy", SERVICE_NAME);
    }

    @GetMapping("/healthz")
    public HealthStatusResponse healthz() {
        return new HealthStatusResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    /**
     * Ready once the database check reports UP.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthStatusResponse> readyz() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
            if (health instanceof CompositeHealth composite) {
                HealthComponent db = composite.getComponents().get("db");
                if (db instanceof Health dbHealth) {
                    status = dbHealth.getStatus().getCode();
                }
            }
        } catch (RuntimeException ex) {
            status = Status.DOWN.getCode();
        }
        HealthStatusResponse body = new HealthStatusResponse(status, Instant.now(clock).toString());
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(body);
    }

    public record ServiceHealthResponse(String status, String service) {
    }

    public record HealthStatusResponse(String status, String timestamp) {
    }
}
