package com.loopPhones.analysis.grading;

import com.loopPhones.model.enums.Grade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Grades a device from photos. Detection is delegated to the configured
 * {@link DamageDetector}; the grade itself is a fixed thresholding of the
 * weighted damage score:
 * <pre>
 *   0       excellent (0.95)
 *   1..10   good      (0.92)
 *   11..30  fair      (0.89)
 *   > 30    poor      (0.87)
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GradingEngine {

    public static final String DEFAULT_MODEL_VERSION = "grading-default-v1";

    private final DamageDetector damageDetector;

    public GradingResult grade(List<String> imageRefs) {
        if (imageRefs == null || imageRefs.isEmpty()) {
            return defaultGrading();
        }

        Map<DamageType, DamageDetection> detections = damageDetector.detect(imageRefs);
        DamageCounts counts = DamageCounts.from(detections);
        GradingResult result = fromCounts(counts, damageDetector.getModelVersion()).toBuilder()
                .detections(detections)
                .imageUrls(imageRefs)
                .build();

        log.info("Graded {} images: grade={}, damageScore={}", imageRefs.size(), result.getGrade(), result.getDamageScore());
        return result;
    }

    /** Deterministic grade from damage counts. Negative counts are treated as zero. */
    public GradingResult fromCounts(DamageCounts counts, String modelVersion) {
        DamageCounts safe = new DamageCounts(
                Math.max(counts.getScreenScratches(), 0),
                Math.max(counts.getScreenCracks(), 0),
                Math.max(counts.getBodyScratches(), 0),
                Math.max(counts.getBodyDents(), 0));
        int damageScore = safe.damageScore();

        Grade grade;
        double confidence;
        if (damageScore == 0) {
            grade = Grade.EXCELLENT;
            confidence = 0.95;
        } else if (damageScore <= 10) {
            grade = Grade.GOOD;
            confidence = 0.92;
        } else if (damageScore <= 30) {
            grade = Grade.FAIR;
            confidence = 0.89;
        } else {
            grade = Grade.POOR;
            confidence = 0.87;
        }

        return GradingResult.builder()
                .grade(grade)
                .confidenceScore(confidence)
                .screenScratchesCount(safe.getScreenScratches())
                .screenCracksCount(safe.getScreenCracks())
                .bodyScratchesCount(safe.getBodyScratches())
                .bodyDentsCount(safe.getBodyDents())
                .damageScore(damageScore)
                .modelVersion(modelVersion)
                .build();
    }

    /** Neutral low-confidence placeholder used when there is nothing to grade. */
    public GradingResult defaultGrading() {
        return GradingResult.builder()
                .grade(Grade.GOOD)
                .confidenceScore(0.50)
                .damageScore(0)
                .modelVersion(DEFAULT_MODEL_VERSION)
                .build();
    }
}
