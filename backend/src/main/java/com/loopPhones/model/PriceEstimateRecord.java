package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.analysis.pricing.PriceEstimate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceEstimateRecord {
    private String id;

    @PropertyName("device_id")
    private String deviceId;

    private Timestamp timestamp;

    @PropertyName("estimated_resale_price")
    private Double estimatedResalePrice;

    @PropertyName("market_average_price")
    private Double marketAveragePrice;

    @PropertyName("confidence_interval_lower")
    private Double confidenceIntervalLower;

    @PropertyName("confidence_interval_upper")
    private Double confidenceIntervalUpper;

    @PropertyName("model_version")
    private String modelVersion;

    @PropertyName("feature_importance")
    private Map<String, Double> featureImportance;

    public static PriceEstimateRecord fromEstimate(String deviceId, PriceEstimate estimate) {
        return PriceEstimateRecord.builder()
                .deviceId(deviceId)
                .estimatedResalePrice(estimate.getEstimatedResalePrice())
                .marketAveragePrice(estimate.getMarketAveragePrice())
                .confidenceIntervalLower(estimate.getConfidenceIntervalLower())
                .confidenceIntervalUpper(estimate.getConfidenceIntervalUpper())
                .modelVersion(estimate.getModelVersion())
                .featureImportance(new HashMap<>(estimate.getFeatureImportance()))
                .build();
    }
}
