package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.analysis.health.TelemetryReading;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TelemetrySnapshot {
    private String id;

    @PropertyName("device_id")
    private String deviceId;

    private Timestamp timestamp;

    @PropertyName("battery_cycle_count")
    private Integer batteryCycleCount;

    @PropertyName("battery_health_percentage")
    private Double batteryHealthPercentage;

    @PropertyName("battery_voltage")
    private Double batteryVoltage;

    @PropertyName("battery_temperature")
    private Double batteryTemperature;

    @PropertyName("cpu_throttling_events")
    private Integer cpuThrottlingEvents;

    @PropertyName("thermal_events_count")
    private Integer thermalEventsCount;

    @PropertyName("crash_count")
    private Integer crashCount;

    /** Predicted at ingest time */
    @PropertyName("predicted_rul_days")
    private Integer predictedRulDays;

    @PropertyName("failure_probability")
    private Double failureProbability;

    /** Missing values fall back to a healthy reading. */
    public TelemetryReading toReading() {
        TelemetryReading.TelemetryReadingBuilder reading = TelemetryReading.builder()
                .timestamp(Timestamps.toInstant(timestamp));
        if (batteryCycleCount != null)
            reading.batteryCycleCount(batteryCycleCount);
        if (batteryHealthPercentage != null)
            reading.batteryHealthPercentage(batteryHealthPercentage);
        if (batteryTemperature != null)
            reading.batteryTemperature(batteryTemperature);
        if (thermalEventsCount != null)
            reading.thermalEventsCount(thermalEventsCount);
        if (crashCount != null)
            reading.crashCount(crashCount);
        return reading.build();
    }
}
