package com.loopPhones.controller;

import com.loopPhones.dto.LifecycleEventCreateDTO;
import com.loopPhones.dto.PassportCreateDTO;
import com.loopPhones.dto.PassportResponseDTO;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.model.DigitalPassport;
import com.loopPhones.service.PassportLifecycleService;
import com.loopPhones.service.PassportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/passports")
@RequiredArgsConstructor
@Validated
public class PassportController {

    private final PassportLifecycleService lifecycleService;
    private final PassportService passportService;

    @PostMapping
    public ResponseEntity<PassportResponseDTO> createPassport(@Valid @RequestBody PassportCreateDTO request) {
        DigitalPassport passport = lifecycleService.createPassport(request.getDeviceId(), request.getOwnerAddress());
        return ResponseEntity.status(HttpStatus.CREATED).body(PassportResponseDTO.fromModel(passport));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PassportResponseDTO> getPassport(@PathVariable String id) {
        return ResponseEntity.ok(PassportResponseDTO.fromModel(passportService.getPassportById(id)));
    }

    @GetMapping("/device/{deviceId}")
    public ResponseEntity<PassportResponseDTO> getPassportByDevice(@PathVariable String deviceId) {
        DigitalPassport passport = passportService.findByDeviceId(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("No passport for device " + deviceId));
        return ResponseEntity.ok(PassportResponseDTO.fromModel(passport));
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<PassportResponseDTO> recordEvent(
            @PathVariable String id,
            @Valid @RequestBody LifecycleEventCreateDTO eventDto) {
        DigitalPassport passport = lifecycleService.recordEvent(id, eventDto.toEvent());
        return ResponseEntity.ok(PassportResponseDTO.fromModel(passport));
    }
}
