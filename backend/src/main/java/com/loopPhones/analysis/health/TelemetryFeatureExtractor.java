package com.loopPhones.analysis.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns an unordered telemetry window into the aggregate features the health
 * heuristic works on. Readings are sorted by timestamp (missing timestamps last),
 * battery health is clamped to [0,100] and negative counters to 0.
 */
@Slf4j
@Component
public class TelemetryFeatureExtractor {

    private static final Comparator<TelemetryReading> BY_TIMESTAMP = Comparator.comparing(
            TelemetryReading::getTimestamp, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    public TelemetryFeatures extract(List<TelemetryReading> history) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("Telemetry history is empty");
        }

        List<TelemetryReading> sorted = new ArrayList<>(history);
        sorted.sort(BY_TIMESTAMP);

        boolean sanitized = false;
        double sumTemp = 0;
        long thermalEvents = 0;
        long crashes = 0;

        for (TelemetryReading reading : sorted) {
            sumTemp += reading.getBatteryTemperature();

            int thermal = reading.getThermalEventsCount();
            int crash = reading.getCrashCount();
            if (thermal < 0 || crash < 0) {
                sanitized = true;
            }
            thermalEvents += Math.max(thermal, 0);
            crashes += Math.max(crash, 0);
        }

        TelemetryReading last = sorted.get(sorted.size() - 1);
        double health = last.getBatteryHealthPercentage();
        if (Double.isNaN(health) || health < 0 || health > 100) {
            sanitized = true;
            health = Double.isNaN(health) ? 100.0 : Math.min(Math.max(health, 0.0), 100.0);
        }
        int cycles = last.getBatteryCycleCount();
        if (cycles < 0) {
            sanitized = true;
            cycles = 0;
        }

        if (sanitized) {
            log.warn("Untrusted telemetry detected ({} readings), out-of-range values were clamped", sorted.size());
        }

        return TelemetryFeatures.builder()
                .currentHealth(health)
                .currentCycle(cycles)
                .avgTemperature(sumTemp / sorted.size())
                .totalThermalEvents(saturate(thermalEvents))
                .totalCrashes(saturate(crashes))
                .sampleCount(sorted.size())
                .sanitized(sanitized)
                .build();
    }

    private static int saturate(long total) {
        return (int) Math.min(total, Integer.MAX_VALUE);
    }
}
