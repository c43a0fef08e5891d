package com.kotsin.stdev.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup when the stdev configuration cannot produce meaningful windows.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfigurationValidator {

    private final StdevProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        validateConfiguration();
    }

    public void validateConfiguration() {
        log.info("🔍 Validating stdev configuration...");

        List<String> errors = validate(properties);

        if (!errors.isEmpty()) {
            log.error("❌ Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", errors));
        }

        log.info("✅ Configuration validation passed");
        logConfigurationSummary();
    }

    static List<String> validate(StdevProperties p) {
        List<String> errors = new ArrayList<>();

        if (p.getWindowSize() < 1) {
            errors.add("stdev.window-size must be at least 1, was " + p.getWindowSize());
        }
        if (p.getMinPeriods() < 1 || p.getMinPeriods() > p.getWindowSize()) {
            errors.add("stdev.min-periods must be between 1 and stdev.window-size, was " + p.getMinPeriods());
        }
        if (isNullOrNegative(p.getCadence()) || p.getCadence().isZero()) {
            errors.add("stdev.cadence must be positive");
        }
        if (isNullOrNegative(p.getGapTolerance())) {
            errors.add("stdev.gap-tolerance must not be negative");
        }
        if (isNullOrNegative(p.getLookback())) {
            errors.add("stdev.lookback must not be negative");
        }
        if (p.getStatePath() == null || p.getStatePath().trim().isEmpty()) {
            errors.add("stdev.state-path is not configured");
        }
        if (!(p.getMaxAbsValue() > 0)) {
            errors.add("stdev.max-abs-value must be positive");
        }
        if (p.getMissingValuePolicy() == null) {
            errors.add("stdev.missing-value-policy is not configured");
        }
        if (p.getStdevMode() == null) {
            errors.add("stdev.stdev-mode is not configured");
        }
        return errors;
    }

    private static boolean isNullOrNegative(Duration d) {
        return d == null || d.isNegative();
    }

    private void logConfigurationSummary() {
        log.info("📋 Configuration Summary:");
        log.info("  Window size: {} (min periods {})", properties.getWindowSize(), properties.getMinPeriods());
        log.info("  Cadence: {} (tolerance {})", properties.getCadence(), properties.getGapTolerance());
        log.info("  Lookback: {}", properties.getLookback());
        log.info("  Missing values: {}, stdev mode: {}", properties.getMissingValuePolicy(), properties.getStdevMode());
        log.info("  State path: {}", properties.getStatePath());
        log.info("  Kafka input: {}, Kafka output: {}",
            properties.getInput().getKafka().isEnabled(), properties.getOutput().getKafka().isEnabled());
    }
}
