package com.topicmatch.backend.global.config;

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
 * Fails startup when the solver boundary is not configured.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SOLVER_SECONDS = 15;
    static final int MAX_SOLVER_SECONDS = 540;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.solver.base-url",
            "app.solver.callback-url",
            "app.solver.callback-hash-key"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional<String> callbackKey = Optional.ofNullable(environment.getProperty("app.solver.callback-hash-key"));
        if (callbackKey.filter(key -> !key.isBlank() && key.length() < 16).isPresent()) {
            problems.add("app.solver.callback-hash-key: must be at least 16 characters");
        }

        String maxTime = environment.getProperty("app.solver.default-max-time-seconds");
        if (maxTime != null) {
            try {
                int seconds = Integer.parseInt(maxTime.trim());
                if (seconds < MIN_SOLVER_SECONDS || seconds > MAX_SOLVER_SECONDS) {
                    problems.add("app.solver.default-max-time-seconds: must be within %d-%d"
                            .formatted(MIN_SOLVER_SECONDS, MAX_SOLVER_SECONDS));
                }
            } catch (NumberFormatException e) {
                problems.add("app.solver.default-max-time-seconds: must be a number");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Invalid environment configuration: " + String.join(", ", problems));
        }
    }
}
