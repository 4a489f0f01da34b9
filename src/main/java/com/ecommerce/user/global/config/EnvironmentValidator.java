package com.ecommerce.user.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails start-up when required settings are missing or still hold development placeholders.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "dev-jwt-secret-key-change-in-production-0000";
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;
    private final JwtProperties jwtProperties;

    public EnvironmentValidator(Environment environment, JwtProperties jwtProperties) {
        this.environment = environment;
        this.jwtProperties = jwtProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "grpc.server.port",
            "server.port"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + var);
            }
        }

        String secret = jwtProperties.secret();
        boolean allowPlaceholder = environment.getProperty("jwt.allow-placeholder-secret", Boolean.class, false);
        if (PLACEHOLDER_SECRET.equals(secret) && !allowPlaceholder) {
            problems.add("jwt.secret still holds the development placeholder");
        }
        if (secret != null && secretLength(secret) < MIN_SECRET_BYTES) {
            problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        if (jwtProperties.refreshExpiration() <= jwtProperties.expiration()) {
            problems.add("jwt.refresh-expiration must be longer than jwt.expiration");
        }
        return problems;
    }

    private int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
