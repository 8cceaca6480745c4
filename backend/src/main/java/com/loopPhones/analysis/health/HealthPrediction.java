package com.loopPhones.analysis.health;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HealthPrediction {
    /** Remaining useful life, always within [1, 730]. */
    int predictedRulDays;
    double failureProbability;
    /** Fractional battery health lost per day. */
    double degradationRate;
    double confidenceScore;
    String modelVersion;
}
