package com.loopPhones.analysis;

import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.analysis.health.HealthPrediction;
import com.loopPhones.analysis.pricing.PriceEstimate;
import com.loopPhones.analysis.recommendation.RecommendationSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnalysisReport {
    String deviceId;
    Instant timestamp;
    DeviceInfo deviceInfo;
    HealthPrediction healthPrediction;

    /** Null when grading was not requested */
    GradingResult grading;

    /** Null when pricing was not requested */
    PriceEstimate priceEstimate;

    RecommendationSet recommendations;

    /** Stages that ran on a fallback or default instead of their primary source */
    @Singular
    List<String> degradedStages;
}
