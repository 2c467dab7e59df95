package com.bookshelf.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required configuration is missing or out of range.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final long MIN_EXPIRATION_MS = 300_000L;
    static final long MAX_EXPIRATION_MS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "app.system-actor.email",
            "app.system-actor.password"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @Order(-1)
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
        for (String key : REQUIRED_KEYS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(key + " is required");
            }
        }

        String expiration = environment.getProperty("jwt.expiration");
        if (expiration != null && !expiration.isBlank()) {
            try {
                long value = Long.parseLong(expiration.trim());
                if (value < MIN_EXPIRATION_MS || value > MAX_EXPIRATION_MS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MS + " and " + MAX_EXPIRATION_MS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number");
            }
        }
        return problems;
    }
}
