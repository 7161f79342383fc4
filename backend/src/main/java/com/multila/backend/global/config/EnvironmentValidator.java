package com.multila.backend.global.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required settings once the context is up and refuses to serve with a broken configuration.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "multila-dev-jwt-secret-change-me-in-production-0001";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "multila.export.directory"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated (export directory: {})", environment.getProperty("multila.export.directory"));
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        boolean relaxed = Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> profile.equals("dev") || profile.equals("test"));
        if (!relaxed && DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            problems.add("jwt.secret still uses the development default");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long millis = Long.parseLong(raw.trim());
                if (millis < 60_000L || millis > 86_400_000L) {
                    problems.add("jwt.expiration must be between 60000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        });

        checkParsable(problems, "multila.time-zone", ZoneId::of);
        checkParsable(problems, "multila.tracking.closed-grace-period", Duration::parse);
        checkParsable(problems, "multila.replay.reload-grace-period", Duration::parse);
        checkParsable(problems, "multila.export.retention", Duration::parse);
        checkParsable(problems, "multila.export.cleanup-interval", Duration::parse);
        return problems;
    }

    private void checkParsable(List<String> problems, String key, Function<String, ?> parser) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            parser.apply(raw.trim());
        } catch (RuntimeException ex) {
            problems.add(key + " has an invalid value '" + raw + "'");
        }
    }
}
