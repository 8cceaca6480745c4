package com.loopPhones.analysis.grading;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedDamageDetectorTest {

    @Test
    @DisplayName("Counts stay within the plausible range for every damage type")
    void countsWithinRange() {
        SimulatedDamageDetector detector = new SimulatedDamageDetector(new Random(7));

        for (int i = 0; i < 200; i++) {
            Map<DamageType, DamageDetection> detections = detector.detect(List.of("img.jpg"));

            assertThat(detections).containsOnlyKeys(DamageType.values());
            assertThat(detections.get(DamageType.SCREEN_SCRATCHES).getCount()).isBetween(0, 5);
            assertThat(detections.get(DamageType.SCREEN_CRACKS).getCount()).isBetween(0, 2);
            assertThat(detections.get(DamageType.BODY_SCRATCHES).getCount()).isBetween(0, 8);
            assertThat(detections.get(DamageType.BODY_DENTS).getCount()).isBetween(0, 3);
            detections.values().forEach(d -> {
                assertThat(d.getBoundingBoxes()).hasSize(d.getCount());
                assertThat(d.getConfidence()).isBetween(0.0, 1.0);
            });
        }
    }

    @Test
    @DisplayName("Same seed produces the same detections")
    void deterministicForSeed() {
        Map<DamageType, DamageDetection> first = new SimulatedDamageDetector(new Random(99)).detect(List.of("a"));
        Map<DamageType, DamageDetection> second = new SimulatedDamageDetector(new Random(99)).detect(List.of("a"));

        assertThat(first).isEqualTo(second);
    }
}
