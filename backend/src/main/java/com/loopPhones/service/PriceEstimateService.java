package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.PriceEstimateRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;

@Service
@RequiredArgsConstructor
public class PriceEstimateService {

    private static final String COLLECTION_NAME = "price_estimates";

    private final Firestore firestore;

    public PriceEstimateRecord save(PriceEstimateRecord record) {
        try {
            DocumentReference docRef = firestore.collection(COLLECTION_NAME).document();
            record.setId(docRef.getId());
            record.setTimestamp(Timestamp.now());
            docRef.set(record).get();
            return record;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot save price estimate: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot save price estimate for device " + record.getDeviceId(), e.getCause());
        }
    }
}
