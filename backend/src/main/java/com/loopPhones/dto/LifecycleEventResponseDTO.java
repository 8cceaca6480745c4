package com.loopPhones.dto;

import com.loopPhones.model.LifecycleEventEntry;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LifecycleEventResponseDTO {
    private String eventType;
    private Instant timestamp;
    private String description;
    private Map<String, Object> metadata;
    private String blockchainTx;

    public static LifecycleEventResponseDTO fromModel(LifecycleEventEntry entry) {
        if (entry == null)
            return null;
        return LifecycleEventResponseDTO.builder()
                .eventType(entry.getEventType())
                .timestamp(Timestamps.toInstant(entry.getTimestamp()))
                .description(entry.getDescription())
                .metadata(entry.getMetadata())
                .blockchainTx(entry.getBlockchainTx())
                .build();
    }
}
