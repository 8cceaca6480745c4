package com.loopPhones.dto;

import com.loopPhones.analysis.lifecycle.LifecycleEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PastOrPresent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEventCreateDTO {
    /** repair, refurbishment, parts_harvested, recycling; other types are kept in history only */
    @NotBlank(message = "Event type is required")
    private String eventType;

    @PastOrPresent(message = "Event time cannot be in the future")
    private Instant timestamp;

    private String description;
    private Map<String, Object> metadata;

    public LifecycleEvent toEvent() {
        return LifecycleEvent.builder()
                .eventType(this.eventType.trim())
                .timestamp(this.timestamp)
                .description(this.description)
                .metadata(this.metadata)
                .build();
    }
}
