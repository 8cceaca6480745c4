package com.loopPhones.analysis.lifecycle;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class LifecycleEvent {
    String eventType;
    Instant timestamp;
    String description;
    Map<String, Object> metadata;

    /** Ledger transaction signature recorded for this event, if any. */
    String ledgerTransaction;
}
