package com.loopPhones.analysis.lifecycle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Cumulative circular-economy counters and scores of one passport. */
@Value
@Builder(toBuilder = true)
public class PassportLifecycleState {
    int circularityScore;
    double carbonFootprint;
    int totalRepairs;
    int totalRefurbishments;
    int partsHarvested;
    int recyclingEvents;

    /** Append-only, in receipt order. */
    @Singular
    List<LifecycleEvent> events;
}
