package com.loopPhones.analysis.grading;

import com.loopPhones.model.enums.Grade;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GradingResult {
    Grade grade;
    double confidenceScore;
    int screenScratchesCount;
    int screenCracksCount;
    int bodyScratchesCount;
    int bodyDentsCount;
    int damageScore;
    String modelVersion;

    @Singular
    Map<DamageType, DamageDetection> detections;

    @Singular
    List<String> imageUrls;

    public DamageCounts toCounts() {
        return new DamageCounts(screenScratchesCount, screenCracksCount, bodyScratchesCount, bodyDentsCount);
    }
}
