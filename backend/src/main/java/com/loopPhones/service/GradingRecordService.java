package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.GradingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class GradingRecordService {

    private static final String COLLECTION_NAME = "grading_records";

    private final Firestore firestore;

    public GradingRecord save(GradingRecord record) {
        try {
            DocumentReference docRef = firestore.collection(COLLECTION_NAME).document();
            record.setId(docRef.getId());
            record.setTimestamp(Timestamp.now());
            docRef.set(record).get();
            log.info("Saved grading record {} for device {}: {}", record.getId(), record.getDeviceId(), record.getGrade());
            return record;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot save grading record: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot save grading record for device " + record.getDeviceId(), e.getCause());
        }
    }

    /** Newest first */
    public List<GradingRecord> getHistory(String deviceId) {
        return query(deviceId, Integer.MAX_VALUE);
    }

    public Optional<GradingRecord> findLatest(String deviceId) {
        return query(deviceId, 1).stream().findFirst();
    }

    private List<GradingRecord> query(String deviceId, int limit) {
        try {
            Query query = firestore.collection(COLLECTION_NAME)
                    .whereEqualTo("device_id", deviceId)
                    .orderBy("timestamp", Query.Direction.DESCENDING);
            if (limit < Integer.MAX_VALUE) {
                query = query.limit(limit);
            }
            List<GradingRecord> records = new ArrayList<>();
            for (QueryDocumentSnapshot doc : query.get().get().getDocuments()) {
                GradingRecord record = doc.toObject(GradingRecord.class);
                record.setId(doc.getId());
                records.add(record);
            }
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get grading records: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get grading records of device " + deviceId, e.getCause());
        }
    }
}
