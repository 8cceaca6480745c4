package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.analysis.lifecycle.PassportLifecycleState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DigitalPassport {
    /** "PASS-" + device id */
    private String id;

    @PropertyName("device_id")
    private String deviceId;

    @PropertyName("mint_address")
    private String mintAddress;

    @PropertyName("owner_address")
    private String ownerAddress;

    @PropertyName("circularity_score")
    private Integer circularityScore;

    @PropertyName("total_repairs")
    private Integer totalRepairs;

    @PropertyName("total_refurbishments")
    private Integer totalRefurbishments;

    @PropertyName("parts_harvested")
    private Integer partsHarvested;

    @PropertyName("recycling_events")
    private Integer recyclingEvents;

    @PropertyName("lifecycle_events")
    private List<LifecycleEventEntry> lifecycleEvents;

    /** kg CO2e */
    @PropertyName("carbon_footprint")
    private Double carbonFootprint;

    @PropertyName("created_at")
    private Timestamp createdAt;

    @PropertyName("updated_at")
    private Timestamp updatedAt;

    public static String idForDevice(String deviceId) {
        return "PASS-" + deviceId;
    }

    public PassportLifecycleState toState() {
        List<LifecycleEventEntry> entries = lifecycleEvents == null ? List.of() : lifecycleEvents;
        return PassportLifecycleState.builder()
                .circularityScore(circularityScore == null ? 0 : circularityScore)
                .carbonFootprint(carbonFootprint == null ? 0.0 : carbonFootprint)
                .totalRepairs(valueOrZero(totalRepairs))
                .totalRefurbishments(valueOrZero(totalRefurbishments))
                .partsHarvested(valueOrZero(partsHarvested))
                .recyclingEvents(valueOrZero(recyclingEvents))
                .events(entries.stream().map(LifecycleEventEntry::toEvent).collect(Collectors.toList()))
                .build();
    }

    public void applyState(PassportLifecycleState state) {
        this.circularityScore = state.getCircularityScore();
        this.carbonFootprint = state.getCarbonFootprint();
        this.totalRepairs = state.getTotalRepairs();
        this.totalRefurbishments = state.getTotalRefurbishments();
        this.partsHarvested = state.getPartsHarvested();
        this.recyclingEvents = state.getRecyclingEvents();
        this.lifecycleEvents = state.getEvents().stream()
                .map(LifecycleEventEntry::fromEvent)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
