package com.loopPhones.controller;

import com.loopPhones.dto.GradingRequestDTO;
import com.loopPhones.dto.GradingResponseDTO;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.model.GradingRecord;
import com.loopPhones.service.GradingRecordService;
import com.loopPhones.service.GradingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/grading")
@RequiredArgsConstructor
@Validated
public class GradingController {

    private final GradingService gradingService;
    private final GradingRecordService gradingRecordService;

    @PostMapping
    public ResponseEntity<GradingResponseDTO> gradeDevice(@Valid @RequestBody GradingRequestDTO request) {
        GradingRecord record = gradingService.gradeDevice(request.getDeviceId(), request.getImageUrls());
        return ResponseEntity.status(HttpStatus.CREATED).body(GradingResponseDTO.fromModel(record));
    }

    /** Photos taken at a collection point, uploaded to Firebase Storage before grading */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<GradingResponseDTO> gradeUploads(
            @RequestParam("deviceId") String deviceId,
            @RequestPart("files") List<MultipartFile> files) {
        GradingRecord record = gradingService.gradeUploads(deviceId, files);
        return ResponseEntity.status(HttpStatus.CREATED).body(GradingResponseDTO.fromModel(record));
    }

    @GetMapping("/{deviceId}")
    public ResponseEntity<List<GradingResponseDTO>> getHistory(@PathVariable String deviceId) {
        List<GradingRecord> history = gradingRecordService.getHistory(deviceId);
        if (history.isEmpty()) {
            throw new ResourceNotFoundException("No grading history for device " + deviceId);
        }
        return ResponseEntity.ok(history.stream()
                .map(GradingResponseDTO::fromModel)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{deviceId}/latest")
    public ResponseEntity<GradingResponseDTO> getLatest(@PathVariable String deviceId) {
        GradingRecord latest = gradingRecordService.findLatest(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("No grading for device " + deviceId));
        return ResponseEntity.ok(GradingResponseDTO.fromModel(latest));
    }
}
