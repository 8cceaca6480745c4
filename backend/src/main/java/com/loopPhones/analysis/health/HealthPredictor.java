package com.loopPhones.analysis.health;

import java.util.List;

/**
 * Predicts remaining useful life and failure risk from a telemetry window.
 * Implementations backed by a learned model throw
 * {@link com.loopPhones.exception.ModelUnavailableException} when they cannot answer.
 */
public interface HealthPredictor {

    HealthPrediction predict(List<TelemetryReading> history);
}
