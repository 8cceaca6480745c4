package com.loopPhones.analysis.health;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TelemetryFeatures {
    double currentHealth;
    int currentCycle;
    double avgTemperature;
    int totalThermalEvents;
    int totalCrashes;
    int sampleCount;

    /** True when at least one reading had to be clamped into range. */
    boolean sanitized;
}
