package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.analysis.lifecycle.LifecycleEvent;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/** One entry of a passport's lifecycle history as stored in Firestore. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LifecycleEventEntry {
    @PropertyName("event_type")
    private String eventType;

    private Timestamp timestamp;
    private String description;
    private Map<String, Object> metadata;

    @PropertyName("blockchain_tx")
    private String blockchainTx;

    public static LifecycleEventEntry fromEvent(LifecycleEvent event) {
        return LifecycleEventEntry.builder()
                .eventType(event.getEventType())
                .timestamp(Timestamps.fromInstant(event.getTimestamp()))
                .description(event.getDescription())
                .metadata(event.getMetadata() == null ? null : new HashMap<>(event.getMetadata()))
                .blockchainTx(event.getLedgerTransaction())
                .build();
    }

    public LifecycleEvent toEvent() {
        return LifecycleEvent.builder()
                .eventType(eventType)
                .timestamp(Timestamps.toInstant(timestamp))
                .description(description)
                .metadata(metadata)
                .ledgerTransaction(blockchainTx)
                .build();
    }
}
