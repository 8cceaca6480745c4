package com.loopPhones.analysis.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rule-based RUL estimate. Degradation starts at 5% per day and grows with
 * cycle count, heat, thermal events and crashes; RUL is the time until battery
 * health reaches 20% (or 0% once already below).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeuristicHealthPredictor implements HealthPredictor {

    public static final String MODEL_VERSION = "heuristic-health-v1";

    static final int MIN_RUL_DAYS = 1;
    static final int MAX_RUL_DAYS = 730;
    static final double BASE_DEGRADATION_RATE = 0.05;
    static final double FAILURE_HEALTH_THRESHOLD = 20.0;
    static final double HEURISTIC_CONFIDENCE = 0.88;

    private final TelemetryFeatureExtractor featureExtractor;

    @Override
    public HealthPrediction predict(List<TelemetryReading> history) {
        if (history == null || history.isEmpty()) {
            return defaultPrediction();
        }
        return predict(featureExtractor.extract(history));
    }

    HealthPrediction predict(TelemetryFeatures features) {
        double health = features.getCurrentHealth();
        int cycles = features.getCurrentCycle();
        double avgTemp = features.getAvgTemperature();
        int thermalEvents = features.getTotalThermalEvents();
        int crashes = features.getTotalCrashes();

        double degradationRate = BASE_DEGRADATION_RATE;
        if (cycles > 500)
            degradationRate += 0.02;
        if (cycles > 1000)
            degradationRate += 0.03;
        if (avgTemp > 35)
            degradationRate += 0.01;
        if (avgTemp > 40)
            degradationRate += 0.02;
        degradationRate += thermalEvents * 0.001;
        degradationRate += crashes * 0.005;

        int rulDays;
        if (health <= FAILURE_HEALTH_THRESHOLD) {
            rulDays = degradationRate > 0 ? (int) (health / degradationRate) : 30;
        } else {
            rulDays = degradationRate > 0 ? (int) ((health - FAILURE_HEALTH_THRESHOLD) / degradationRate) : 365;
        }
        rulDays = Math.min(Math.max(rulDays, MIN_RUL_DAYS), MAX_RUL_DAYS);

        double failureProbability = clampUnit(1.0 - health / 100.0);
        if (thermalEvents > 10)
            failureProbability = clampUnit(failureProbability + 0.10);
        if (crashes > 5)
            failureProbability = clampUnit(failureProbability + 0.15);

        log.debug("Health heuristic: health={}, cycles={}, avgTemp={}, rate={}, rul={}",
                health, cycles, avgTemp, degradationRate, rulDays);

        return HealthPrediction.builder()
                .predictedRulDays(rulDays)
                .failureProbability(round(failureProbability, 1000.0))
                .degradationRate(round(degradationRate, 10000.0))
                .confidenceScore(HEURISTIC_CONFIDENCE)
                .modelVersion(MODEL_VERSION)
                .build();
    }

    /** Low-confidence placeholder for a device that has not reported telemetry yet. */
    public HealthPrediction defaultPrediction() {
        return HealthPrediction.builder()
                .predictedRulDays(365)
                .failureProbability(0.10)
                .degradationRate(BASE_DEGRADATION_RATE)
                .confidenceScore(0.50)
                .modelVersion(MODEL_VERSION)
                .build();
    }

    private static double clampUnit(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
