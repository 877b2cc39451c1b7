package com.threadgraph.core.engine.config;

import com.threadgraph.core.exception.ThreadGraphConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Looks a setting up as a system property first, then as an environment variable
 * ({@code threadgraph.lock.wait-timeout} becomes {@code THREADGRAPH_LOCK_WAIT_TIMEOUT}).
 */
@Slf4j
public class ThreadGraphConfigResolver {

    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environment;

    public ThreadGraphConfigResolver() {
        this(System::getProperty, System::getenv);
    }

    public ThreadGraphConfigResolver(UnaryOperator<String> systemProperties, UnaryOperator<String> environment) {
        this.systemProperties = systemProperties;
        this.environment = environment;
    }

    public static String toEnvironmentName(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    public Optional<String> resolve(String property) {
        String value = systemProperties.apply(property);
        if (value == null || value.isBlank()) {
            value = environment.apply(toEnvironmentName(property));
        }
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
    }

    public String getString(String property, String defaultValue) {
        return resolve(property).orElse(defaultValue);
    }

    public int getInt(String property, int defaultValue) {
        return resolve(property).map(value -> {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new ThreadGraphConfigurationException(property, "not an integer: " + value, e);
            }
        }).orElse(defaultValue);
    }

    /**
     * Accepts ISO-8601 durations such as {@code PT10M}.
     */
    public Duration getDuration(String property, Duration defaultValue) {
        return resolve(property).map(value -> {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new ThreadGraphConfigurationException(property, "not an ISO-8601 duration: " + value, e);
            }
        }).orElse(defaultValue);
    }

    public <E extends Enum<E>> E getEnum(String property, Class<E> type, E defaultValue) {
        return resolve(property).map(value -> {
            try {
                return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown value {} for {}", value, property);
                throw new ThreadGraphConfigurationException(property, "unknown value " + value, e);
            }
        }).orElse(defaultValue);
    }
}
