package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class TelemetryService {

    private static final String COLLECTION_NAME = "telemetry_snapshots";
    private static final String DEVICE_ID = "device_id";
    private static final String TIMESTAMP = "timestamp";

    private final Firestore firestore;
    private final Clock clock;

    public TelemetrySnapshot save(TelemetrySnapshot snapshot) {
        try {
            DocumentReference docRef = firestore.collection(COLLECTION_NAME).document();
            snapshot.setId(docRef.getId());
            if (snapshot.getTimestamp() == null) {
                snapshot.setTimestamp(Timestamp.now());
            }
            docRef.set(snapshot).get();
            log.debug("Stored telemetry snapshot {} for device {}", snapshot.getId(), snapshot.getDeviceId());
            return snapshot;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot save telemetry: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot save telemetry for device " + snapshot.getDeviceId(), e.getCause());
        }
    }

    /** Snapshots of the last {@code days} days, oldest first */
    public List<TelemetrySnapshot> getHistory(String deviceId, int days) {
        Timestamp cutoff = Timestamps.fromInstant(clock.instant().minus(Duration.ofDays(days)));
        return run(firestore.collection(COLLECTION_NAME)
                .whereEqualTo(DEVICE_ID, deviceId)
                .whereGreaterThanOrEqualTo(TIMESTAMP, cutoff)
                .orderBy(TIMESTAMP), "telemetry history of device " + deviceId);
    }

    /**
     * Analysis window: at most {@code maxSnapshots} most recent snapshots taken at or
     * after {@code since}, returned oldest first.
     */
    public List<TelemetrySnapshot> getAnalysisWindow(String deviceId, Instant since, int maxSnapshots) {
        Timestamp cutoff = Timestamps.fromInstant(since);
        List<TelemetrySnapshot> newestFirst = run(firestore.collection(COLLECTION_NAME)
                .whereEqualTo(DEVICE_ID, deviceId)
                .whereGreaterThanOrEqualTo(TIMESTAMP, cutoff)
                .orderBy(TIMESTAMP, Query.Direction.DESCENDING)
                .limit(maxSnapshots), "telemetry window of device " + deviceId);
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    /** Most recent snapshots regardless of age, newest first */
    public List<TelemetrySnapshot> getRecent(String deviceId, int limit) {
        return run(firestore.collection(COLLECTION_NAME)
                .whereEqualTo(DEVICE_ID, deviceId)
                .orderBy(TIMESTAMP, Query.Direction.DESCENDING)
                .limit(limit), "recent telemetry of device " + deviceId);
    }

    public Optional<TelemetrySnapshot> findLatest(String deviceId) {
        return getRecent(deviceId, 1).stream().findFirst();
    }

    private List<TelemetrySnapshot> run(Query query, String what) {
        try {
            List<TelemetrySnapshot> snapshots = new ArrayList<>();
            for (QueryDocumentSnapshot doc : query.get().get().getDocuments()) {
                TelemetrySnapshot snapshot = doc.toObject(TelemetrySnapshot.class);
                snapshot.setId(doc.getId());
                snapshots.add(snapshot);
            }
            return snapshots;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get " + what + ": operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get " + what, e.getCause());
        }
    }
}
