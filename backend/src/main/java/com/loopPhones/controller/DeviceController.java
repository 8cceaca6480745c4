package com.loopPhones.controller;

import com.loopPhones.dto.DeviceCreateDTO;
import com.loopPhones.dto.DeviceResponseDTO;
import com.loopPhones.model.Device;
import com.loopPhones.model.enums.DeviceStatus;
import com.loopPhones.service.DeviceService;
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
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
@Validated
public class DeviceController {

    private final DeviceService deviceService;

    @PostMapping
    public ResponseEntity<DeviceResponseDTO> registerDevice(@Valid @RequestBody DeviceCreateDTO deviceDto) {
        Device device = deviceService.registerDevice(deviceDto.toModel());
        return ResponseEntity.status(HttpStatus.CREATED).body(DeviceResponseDTO.fromModel(device));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DeviceResponseDTO> getDevice(@PathVariable String id) {
        return ResponseEntity.ok(DeviceResponseDTO.fromModel(deviceService.getDeviceById(id)));
    }

    @GetMapping
    public ResponseEntity<List<DeviceResponseDTO>> listDevices(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        DeviceStatus filter = status == null ? null : DeviceStatus.fromLabel(status);
        List<DeviceResponseDTO> dtos = deviceService.listDevices(filter, skip, limit).stream()
                .map(DeviceResponseDTO::fromModel)
                .collect(Collectors.toList());
        return ResponseEntity.ok(dtos);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDevice(@PathVariable String id) {
        deviceService.deleteDevice(id);
        return ResponseEntity.noContent().build();
    }
}
