package com.loopPhones.service;

import com.loopPhones.analysis.lifecycle.LifecycleEvent;
import com.loopPhones.analysis.lifecycle.LifecycleScoreTracker;
import com.loopPhones.analysis.lifecycle.PassportLifecycleState;
import com.loopPhones.analysis.lifecycle.PassportLockRegistry;
import com.loopPhones.exception.ConflictException;
import com.loopPhones.ledger.LedgerReceipt;
import com.loopPhones.ledger.PassportLedger;
import com.loopPhones.model.Device;
import com.loopPhones.model.DigitalPassport;
import com.loopPhones.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mints passports and applies lifecycle events to them. Every write to a
 * passport happens under that passport's lock; the caller is responsible for
 * not submitting the same event twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PassportLifecycleService {

    private final PassportService passportService;
    private final DeviceService deviceService;
    private final PassportLedger ledger;
    private final LifecycleScoreTracker scoreTracker;
    private final PassportLockRegistry lockRegistry;
    private final Clock clock;

    public DigitalPassport createPassport(String deviceId, String ownerAddress) {
        Device device = deviceService.getDeviceById(deviceId);
        String passportId = DigitalPassport.idForDevice(deviceId);

        return lockRegistry.withLock(passportId, () -> {
            if (passportService.findByDeviceId(deviceId).isPresent()) {
                throw new ConflictException("Passport already exists for device " + deviceId);
            }

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("device_id", device.getId());
            metadata.put("model", device.getModel());
            metadata.put("manufacturer", device.getManufacturer());
            Instant purchaseDate = Timestamps.toInstant(device.getPurchaseDate());
            metadata.put("purchase_date", purchaseDate == null ? null : purchaseDate.toString());

            LedgerReceipt receipt = ledger.mint(deviceId, ownerAddress, metadata);

            Map<String, Object> receiptData = new HashMap<>();
            receiptData.put("mint_address", receipt.getMintAddress());
            receiptData.put("transaction_signature", receipt.getTransactionSignature());
            receiptData.put("network", receipt.getNetwork());
            receiptData.put("explorer_url", receipt.getExplorerUrl());

            LifecycleEvent mintEvent = LifecycleEvent.builder()
                    .eventType("minted")
                    .timestamp(clock.instant())
                    .description("Digital Passport created")
                    .metadata(receiptData)
                    .ledgerTransaction(receipt.getTransactionSignature())
                    .build();

            DigitalPassport passport = DigitalPassport.builder()
                    .id(passportId)
                    .deviceId(deviceId)
                    .mintAddress(receipt.getMintAddress())
                    .ownerAddress(ownerAddress)
                    .build();
            passport.applyState(scoreTracker.initialState(mintEvent));

            passportService.save(passport);
            deviceService.linkPassport(deviceId, passportId, receipt.getMintAddress());

            log.info("Passport {} minted for device {} ({})", passportId, deviceId, receipt.getMintAddress());
            return passport;
        });
    }

    /**
     * Records the event on the ledger, then recomputes counters and scores with
     * the device's usage at the event time. Events without a timestamp are
     * stamped with the receipt time.
     */
    public DigitalPassport recordEvent(String passportId, LifecycleEvent event) {
        return lockRegistry.withLock(passportId, () -> {
            DigitalPassport passport = passportService.getPassportById(passportId);
            Device device = deviceService.getDeviceById(passport.getDeviceId());

            LifecycleEvent stamped = event.getTimestamp() == null
                    ? event.toBuilder().timestamp(clock.instant()).build()
                    : event;
            Instant purchaseDate = Timestamps.toInstant(device.getPurchaseDate());
            // reject events before purchase before anything reaches the ledger
            scoreTracker.usageYears(purchaseDate, stamped.getTimestamp());

            Map<String, Object> payload = new HashMap<>();
            payload.put("event_type", stamped.getEventType());
            payload.put("timestamp", stamped.getTimestamp().toString());
            payload.put("description", stamped.getDescription());
            if (stamped.getMetadata() != null) {
                payload.put("metadata", stamped.getMetadata());
            }
            LedgerReceipt receipt = ledger.record(passport.getMintAddress(), stamped.getEventType(), payload);

            PassportLifecycleState updated = scoreTracker.apply(
                    passport.toState(),
                    stamped.toBuilder().ledgerTransaction(receipt.getTransactionSignature()).build(),
                    purchaseDate);
            passport.applyState(updated);
            passportService.save(passport);

            log.info("Passport {}: recorded {} (circularity={}, carbon={} kg)", passportId,
                    stamped.getEventType(), updated.getCircularityScore(), updated.getCarbonFootprint());
            return passport;
        });
    }
}
