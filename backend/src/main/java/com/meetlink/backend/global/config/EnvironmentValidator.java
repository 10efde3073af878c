package com.meetlink.backend.global.config;

import java.net.URI;
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
 * Fails startup when keys the meeting flow cannot run without are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final List<String> REQUIRED_KEYS = List.of(
            "spring.datasource.url",
            "jwt.secret",
            "app.meeting.join-base-url",
            "app.video-provider.base-url",
            "app.video-provider.api-key"
    );

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        checkAbsoluteUrl("app.meeting.join-base-url", problems);
        checkAbsoluteUrl("app.video-provider.base-url", problems);

        Integer maxDuration = environment.getProperty("app.meeting.max-duration-minutes", Integer.class);
        if (maxDuration != null && (maxDuration < 1 || maxDuration > 40)) {
            problems.add("app.meeting.max-duration-minutes: must be between 1 and 40");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }
        log.info("Environment validation passed");
    }

    private void checkAbsoluteUrl(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            URI uri = URI.create(raw.trim());
            if (!uri.isAbsolute()) {
                problems.add(key + ": must be an absolute URL");
            }
        } catch (IllegalArgumentException ex) {
            problems.add(key + ": not a valid URL");
        }
    }
}
