package com.vanphong.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks the configuration keys the service cannot run without once the context is ready.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "vanphong-dev-jwt-secret-change-me-in-production-2025";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_EXPIRATION_MILLIS = 60_000L;
    private static final long MAX_EXPIRATION_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        jwtSecret.filter(secret -> secret.length() < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " characters"));
        if (jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_EXPIRATION_MILLIS || expiration > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration: must be between " + MIN_EXPIRATION_MILLIS + " and " + MAX_EXPIRATION_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", problems));
        }
        log.info("Configuration validated");
    }
}
