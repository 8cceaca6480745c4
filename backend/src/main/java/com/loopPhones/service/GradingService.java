package com.loopPhones.service;

import com.loopPhones.analysis.grading.GradingEngine;
import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.exception.InvalidInputException;
import com.loopPhones.model.GradingRecord;
import com.loopPhones.model.enums.DeviceStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GradingService {

    private final DeviceService deviceService;
    private final GradingRecordService gradingRecordService;
    private final GradingEngine gradingEngine;
    private final FirebaseStorageService storageService;

    /** Grades the photos, stores the record and marks the device as graded */
    public GradingRecord gradeDevice(String deviceId, List<String> imageUrls) {
        deviceService.getDeviceById(deviceId);

        GradingResult result = gradingEngine.grade(imageUrls);
        GradingRecord record = gradingRecordService.save(GradingRecord.fromResult(deviceId, result));
        deviceService.updateStatus(deviceId, DeviceStatus.GRADED);

        log.info("Device {} graded {} (damage score {}, {} images)", deviceId,
                result.getGrade().toLabel(), result.getDamageScore(), result.getImageUrls().size());
        return record;
    }

    public GradingRecord gradeUploads(String deviceId, List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InvalidInputException("At least one image is required");
        }
        deviceService.getDeviceById(deviceId);

        List<String> imageUrls = new ArrayList<>();
        for (MultipartFile file : files) {
            imageUrls.add(storageService.uploadGradingImage(deviceId, file));
        }
        return gradeDevice(deviceId, imageUrls);
    }
}
