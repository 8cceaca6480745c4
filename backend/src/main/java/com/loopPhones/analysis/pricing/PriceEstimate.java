package com.loopPhones.analysis.pricing;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PriceEstimate {
    double estimatedResalePrice;
    double marketAveragePrice;
    double confidenceIntervalLower;
    double confidenceIntervalUpper;
    String modelVersion;
    Map<String, Double> featureImportance;
}
