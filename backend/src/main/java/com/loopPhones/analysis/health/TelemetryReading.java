package com.loopPhones.analysis.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One point-in-time device reading as seen by the health predictor. */
@Value
@Builder
public class TelemetryReading {
    Instant timestamp;

    @Builder.Default
    int batteryCycleCount = 0;

    @Builder.Default
    double batteryHealthPercentage = 100.0;

    @Builder.Default
    double batteryTemperature = 25.0;

    @Builder.Default
    int thermalEventsCount = 0;

    @Builder.Default
    int crashCount = 0;
}
