package com.loopPhones.dto;

import com.loopPhones.model.Device;
import com.loopPhones.model.enums.DeviceStatus;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceResponseDTO {
    private String id;
    private String model;
    private String manufacturer;
    private Instant purchaseDate;
    private Double purchasePrice;
    private String currentOwner;
    private DeviceStatus status;
    private Integer storageGb;
    private Integer ramGb;
    private Integer originalBatteryCapacity;
    private String passportId;
    private String passportMintAddress;
    private Instant createdAt;
    private Instant updatedAt;

    public static DeviceResponseDTO fromModel(Device device) {
        if (device == null)
            return null;
        return DeviceResponseDTO.builder()
                .id(device.getId())
                .model(device.getModel())
                .manufacturer(device.getManufacturer())
                .purchaseDate(Timestamps.toInstant(device.getPurchaseDate()))
                .purchasePrice(device.getPurchasePrice())
                .currentOwner(device.getCurrentOwner())
                .status(device.getStatus())
                .storageGb(device.getStorageGb())
                .ramGb(device.getRamGb())
                .originalBatteryCapacity(device.getOriginalBatteryCapacity())
                .passportId(device.getPassportId())
                .passportMintAddress(device.getPassportMintAddress())
                .createdAt(Timestamps.toInstant(device.getCreatedAt()))
                .updatedAt(Timestamps.toInstant(device.getUpdatedAt()))
                .build();
    }
}
