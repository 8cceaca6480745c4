package com.loopPhones.dto;

import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.util.Timestamps;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot uploaded by the handset agent. Out-of-range readings are accepted
 * here and sanitized during feature extraction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryCreateDTO {
    @NotBlank(message = "Device ID is required")
    private String deviceId;

    /** Defaults to the receipt time */
    private Instant timestamp;

    @NotNull(message = "Battery cycle count is required")
    private Integer batteryCycleCount;

    @NotNull(message = "Battery health is required")
    private Double batteryHealthPercentage;

    private Double batteryVoltage;
    private Double batteryTemperature;
    private Integer cpuThrottlingEvents;
    private Integer thermalEventsCount;
    private Integer crashCount;

    public TelemetrySnapshot toModel() {
        return TelemetrySnapshot.builder()
                .deviceId(this.deviceId)
                .timestamp(Timestamps.fromInstant(this.timestamp))
                .batteryCycleCount(this.batteryCycleCount)
                .batteryHealthPercentage(this.batteryHealthPercentage)
                .batteryVoltage(this.batteryVoltage)
                .batteryTemperature(this.batteryTemperature)
                .cpuThrottlingEvents(this.cpuThrottlingEvents)
                .thermalEventsCount(this.thermalEventsCount)
                .crashCount(this.crashCount)
                .build();
    }
}
