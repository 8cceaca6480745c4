package com.loopPhones.dto;

import com.loopPhones.model.DigitalPassport;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PassportResponseDTO {
    private String id;
    private String deviceId;
    private String mintAddress;
    private String ownerAddress;
    private Integer circularityScore;
    private Double carbonFootprint;
    private Integer totalRepairs;
    private Integer totalRefurbishments;
    private Integer partsHarvested;
    private Integer recyclingEvents;
    private List<LifecycleEventResponseDTO> lifecycleEvents;
    private Instant createdAt;
    private Instant updatedAt;

    public static PassportResponseDTO fromModel(DigitalPassport passport) {
        if (passport == null)
            return null;
        List<LifecycleEventResponseDTO> events = passport.getLifecycleEvents() == null
                ? List.of()
                : passport.getLifecycleEvents().stream()
                        .map(LifecycleEventResponseDTO::fromModel)
                        .collect(Collectors.toList());
        return PassportResponseDTO.builder()
                .id(passport.getId())
                .deviceId(passport.getDeviceId())
                .mintAddress(passport.getMintAddress())
                .ownerAddress(passport.getOwnerAddress())
                .circularityScore(passport.getCircularityScore())
                .carbonFootprint(passport.getCarbonFootprint())
                .totalRepairs(passport.getTotalRepairs())
                .totalRefurbishments(passport.getTotalRefurbishments())
                .partsHarvested(passport.getPartsHarvested())
                .recyclingEvents(passport.getRecyclingEvents())
                .lifecycleEvents(events)
                .createdAt(Timestamps.toInstant(passport.getCreatedAt()))
                .updatedAt(Timestamps.toInstant(passport.getUpdatedAt()))
                .build();
    }
}
