package com.loopPhones.dto;

import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TelemetryResponseDTO {
    private String id;
    private String deviceId;
    private Instant timestamp;
    private Integer batteryCycleCount;
    private Double batteryHealthPercentage;
    private Double batteryVoltage;
    private Double batteryTemperature;
    private Integer cpuThrottlingEvents;
    private Integer thermalEventsCount;
    private Integer crashCount;
    private Integer predictedRulDays;
    private Double failureProbability;

    public static TelemetryResponseDTO fromModel(TelemetrySnapshot snapshot) {
        if (snapshot == null)
            return null;
        return TelemetryResponseDTO.builder()
                .id(snapshot.getId())
                .deviceId(snapshot.getDeviceId())
                .timestamp(Timestamps.toInstant(snapshot.getTimestamp()))
                .batteryCycleCount(snapshot.getBatteryCycleCount())
                .batteryHealthPercentage(snapshot.getBatteryHealthPercentage())
                .batteryVoltage(snapshot.getBatteryVoltage())
                .batteryTemperature(snapshot.getBatteryTemperature())
                .cpuThrottlingEvents(snapshot.getCpuThrottlingEvents())
                .thermalEventsCount(snapshot.getThermalEventsCount())
                .crashCount(snapshot.getCrashCount())
                .predictedRulDays(snapshot.getPredictedRulDays())
                .failureProbability(snapshot.getFailureProbability())
                .build();
    }
}
