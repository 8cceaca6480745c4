package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.DigitalPassport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/** Firestore access for digital passports. Score updates go through PassportLifecycleService. */
@Service
@RequiredArgsConstructor
public class PassportService {

    private static final String COLLECTION_NAME = "digital_passports";

    private final Firestore firestore;

    public DigitalPassport getPassportById(String passportId) {
        try {
            DocumentSnapshot doc = firestore.collection(COLLECTION_NAME).document(passportId).get().get();
            if (!doc.exists()) {
                throw new ResourceNotFoundException("Passport", passportId);
            }
            DigitalPassport passport = doc.toObject(DigitalPassport.class);
            passport.setId(doc.getId());
            return passport;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get passport: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get passport: " + passportId, e.getCause());
        }
    }

    public Optional<DigitalPassport> findByDeviceId(String deviceId) {
        try {
            List<QueryDocumentSnapshot> docs = firestore.collection(COLLECTION_NAME)
                    .whereEqualTo("device_id", deviceId)
                    .limit(1)
                    .get().get().getDocuments();
            if (docs.isEmpty()) {
                return Optional.empty();
            }
            DigitalPassport passport = docs.get(0).toObject(DigitalPassport.class);
            passport.setId(docs.get(0).getId());
            return Optional.of(passport);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get passport: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get passport of device " + deviceId, e.getCause());
        }
    }

    /** Create or overwrite the passport document under its own id */
    public DigitalPassport save(DigitalPassport passport) {
        try {
            Timestamp now = Timestamp.now();
            if (passport.getCreatedAt() == null) {
                passport.setCreatedAt(now);
            }
            passport.setUpdatedAt(now);
            firestore.collection(COLLECTION_NAME).document(passport.getId()).set(passport).get();
            return passport;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot save passport: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot save passport: " + passport.getId(), e.getCause());
        }
    }
}
