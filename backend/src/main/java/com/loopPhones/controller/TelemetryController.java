package com.loopPhones.controller;

import com.loopPhones.dto.TelemetryCreateDTO;
import com.loopPhones.dto.TelemetryResponseDTO;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.service.TelemetryIngestService;
import com.loopPhones.service.TelemetryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/telemetry")
@RequiredArgsConstructor
@Validated
public class TelemetryController {

    private final TelemetryIngestService ingestService;
    private final TelemetryService telemetryService;

    /** Upload from the handset agent; requires X-Device-API-Key */
    @PostMapping
    public ResponseEntity<TelemetryResponseDTO> ingest(@Valid @RequestBody TelemetryCreateDTO telemetryDto) {
        TelemetrySnapshot saved = ingestService.ingest(telemetryDto.toModel());
        return ResponseEntity.status(HttpStatus.CREATED).body(TelemetryResponseDTO.fromModel(saved));
    }

    @GetMapping("/{deviceId}")
    public ResponseEntity<List<TelemetryResponseDTO>> getHistory(
            @PathVariable String deviceId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days) {
        List<TelemetrySnapshot> history = telemetryService.getHistory(deviceId, days);
        if (history.isEmpty()) {
            throw new ResourceNotFoundException("No telemetry for device " + deviceId + " in the last " + days + " days");
        }
        return ResponseEntity.ok(history.stream()
                .map(TelemetryResponseDTO::fromModel)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{deviceId}/latest")
    public ResponseEntity<TelemetryResponseDTO> getLatest(@PathVariable String deviceId) {
        TelemetrySnapshot latest = telemetryService.findLatest(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("No telemetry for device " + deviceId));
        return ResponseEntity.ok(TelemetryResponseDTO.fromModel(latest));
    }
}
