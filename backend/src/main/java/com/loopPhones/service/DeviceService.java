package com.loopPhones.service;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.loopPhones.exception.ConflictException;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.Device;
import com.loopPhones.model.enums.DeviceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceService {

    private static final String COLLECTION_NAME = "devices";

    private final Firestore firestore;

    /** Register a new device; the IMEI/serial is the document id and must be unique */
    public Device registerDevice(Device device) {
        try {
            DocumentReference docRef = firestore.collection(COLLECTION_NAME).document(device.getId());
            if (docRef.get().get().exists()) {
                throw new ConflictException("Device with ID " + device.getId() + " already exists");
            }
            Timestamp now = Timestamp.now();
            device.setStatus(DeviceStatus.ACTIVE);
            device.setCreatedAt(now);
            device.setUpdatedAt(now);
            docRef.set(device).get();
            log.info("Registered device {} ({} {})", device.getId(), device.getManufacturer(), device.getModel());
            return device;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot register device: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot register device: " + device.getId(), e.getCause());
        }
    }

    public Device getDeviceById(String deviceId) {
        try {
            DocumentSnapshot doc = firestore.collection(COLLECTION_NAME).document(deviceId).get().get();
            if (!doc.exists()) {
                throw new ResourceNotFoundException("Device", deviceId);
            }
            Device device = doc.toObject(Device.class);
            device.setId(doc.getId());
            return device;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get device information: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get device information: " + deviceId, e.getCause());
        }
    }

    public List<Device> listDevices(DeviceStatus status, int skip, int limit) {
        try {
            Query query = firestore.collection(COLLECTION_NAME);
            if (status != null) {
                query = query.whereEqualTo("status", status.name());
            }
            List<Device> devices = new ArrayList<>();
            for (QueryDocumentSnapshot doc : query.offset(skip).limit(limit).get().get().getDocuments()) {
                Device device = doc.toObject(Device.class);
                device.setId(doc.getId());
                devices.add(device);
            }
            return devices;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot get list of devices: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot get list of devices", e.getCause());
        }
    }

    public void updateStatus(String deviceId, DeviceStatus status) {
        update(deviceId, Map.of("status", status.name(), "updated_at", Timestamp.now()));
    }

    public void linkPassport(String deviceId, String passportId, String mintAddress) {
        update(deviceId, Map.of(
                "passport_id", passportId,
                "passport_mint_address", mintAddress,
                "updated_at", Timestamp.now()));
    }

    public String deleteDevice(String deviceId) {
        getDeviceById(deviceId);
        try {
            return firestore.collection(COLLECTION_NAME).document(deviceId)
                    .delete().get().getUpdateTime().toString();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot delete device: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot delete device: " + deviceId, e.getCause());
        }
    }

    private void update(String deviceId, Map<String, Object> fields) {
        try {
            firestore.collection(COLLECTION_NAME).document(deviceId).update(fields).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Cannot update device: operation interrupted", e);
        } catch (ExecutionException e) {
            throw new ServiceException("Cannot update device: " + deviceId, e.getCause());
        }
    }
}
