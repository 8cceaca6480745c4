package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.loopPhones.analysis.health.HealthPrediction;
import com.loopPhones.analysis.health.HealthPredictor;
import com.loopPhones.analysis.health.HeuristicHealthPredictor;
import com.loopPhones.analysis.health.TelemetryReading;
import com.loopPhones.exception.ModelUnavailableException;
import com.loopPhones.model.TelemetrySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores an uploaded telemetry snapshot together with the health prediction
 * made over the device's recent history at upload time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryIngestService {

    static final int PREDICTION_HISTORY_SIZE = 30;

    private final DeviceService deviceService;
    private final TelemetryService telemetryService;
    private final HealthPredictor healthPredictor;
    private final HeuristicHealthPredictor heuristicHealthPredictor;

    public TelemetrySnapshot ingest(TelemetrySnapshot snapshot) {
        deviceService.getDeviceById(snapshot.getDeviceId());
        if (snapshot.getTimestamp() == null) {
            snapshot.setTimestamp(Timestamp.now());
        }

        List<TelemetryReading> history = telemetryService
                .getRecent(snapshot.getDeviceId(), PREDICTION_HISTORY_SIZE).stream()
                .map(TelemetrySnapshot::toReading)
                .collect(Collectors.toList());
        history.add(snapshot.toReading());

        HealthPrediction prediction = predict(history);
        snapshot.setPredictedRulDays(prediction.getPredictedRulDays());
        snapshot.setFailureProbability(prediction.getFailureProbability());

        TelemetrySnapshot saved = telemetryService.save(snapshot);
        log.info("Telemetry stored for device {}: RUL {} days, failure probability {}",
                saved.getDeviceId(), prediction.getPredictedRulDays(), prediction.getFailureProbability());
        return saved;
    }

    private HealthPrediction predict(List<TelemetryReading> history) {
        try {
            return healthPredictor.predict(history);
        } catch (ModelUnavailableException e) {
            log.warn("Health model unavailable at ingest, using heuristic: {}", e.getMessage());
            return heuristicHealthPredictor.predict(history);
        }
    }
}
