package com.loopPhones.analysis.grading;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Stand-in detector for development and demos: it never looks at the images and
 * draws plausible damage counts and boxes from the injected random source.
 * Replace with a real detector bean and set {@code grading.detector} accordingly.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "grading.detector", havingValue = "simulated", matchIfMissing = true)
public class SimulatedDamageDetector implements DamageDetector {

    public static final String MODEL_VERSION = "simulated-detector-v1";

    private final Random random;

    public SimulatedDamageDetector(@Qualifier("gradingRandom") Random random) {
        this.random = random;
    }

    @Override
    public Map<DamageType, DamageDetection> detect(List<String> imageRefs) {
        log.debug("Simulating damage detection over {} images", imageRefs.size());

        Map<DamageType, DamageDetection> detections = new EnumMap<>(DamageType.class);
        detections.put(DamageType.SCREEN_SCRATCHES, simulate(5, 0.85, 0.95,
                new BoxShape(100, 400, 100, 600, 20, 100, 10, 50, 0.80, 0.95)));
        detections.put(DamageType.SCREEN_CRACKS, simulate(2, 0.88, 0.96,
                new BoxShape(100, 400, 100, 600, 50, 200, 5, 20, 0.85, 0.96)));
        detections.put(DamageType.BODY_SCRATCHES, simulate(8, 0.82, 0.93,
                new BoxShape(50, 450, 50, 650, 10, 60, 5, 30, 0.78, 0.92)));
        detections.put(DamageType.BODY_DENTS, simulate(3, 0.80, 0.92,
                new BoxShape(50, 450, 50, 650, 15, 40, 15, 40, 0.75, 0.90)));
        return detections;
    }

    @Override
    public String getModelVersion() {
        return MODEL_VERSION;
    }

    private DamageDetection simulate(int maxCount, double minConfidence, double maxConfidence, BoxShape shape) {
        int count = randomInt(0, maxCount);
        List<BoundingBox> boxes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            boxes.add(BoundingBox.builder()
                    .x(randomInt(shape.minX, shape.maxX))
                    .y(randomInt(shape.minY, shape.maxY))
                    .width(randomInt(shape.minWidth, shape.maxWidth))
                    .height(randomInt(shape.minHeight, shape.maxHeight))
                    .confidence(randomConfidence(shape.minConfidence, shape.maxConfidence))
                    .build());
        }
        return DamageDetection.builder()
                .count(count)
                .confidence(randomConfidence(minConfidence, maxConfidence))
                .boundingBoxes(boxes)
                .build();
    }

    /** Inclusive on both ends. */
    private int randomInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private double randomConfidence(double min, double max) {
        return Math.round((min + random.nextDouble() * (max - min)) * 100.0) / 100.0;
    }

    /** Coordinate, size and confidence ranges for the simulated boxes of one damage type. */
    @AllArgsConstructor
    private static final class BoxShape {
        private final int minX;
        private final int maxX;
        private final int minY;
        private final int maxY;
        private final int minWidth;
        private final int maxWidth;
        private final int minHeight;
        private final int maxHeight;
        private final double minConfidence;
        private final double maxConfidence;
    }
}
