package com.loopPhones.dto;

import com.loopPhones.model.Device;
import com.loopPhones.util.Timestamps;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCreateDTO {
    /** IMEI or serial number */
    @NotBlank(message = "Device ID is required")
    private String id;

    @NotBlank(message = "Model is required")
    private String model;

    @NotBlank(message = "Manufacturer is required")
    private String manufacturer;

    @NotNull(message = "Purchase date is required")
    @PastOrPresent(message = "Purchase date cannot be in the future")
    private Instant purchaseDate;

    @Positive(message = "Purchase price must be > 0")
    private Double purchasePrice;

    private String currentOwner;

    @Positive(message = "Storage must be > 0")
    private Integer storageGb;

    @Positive(message = "RAM must be > 0")
    private Integer ramGb;

    @Positive(message = "Battery capacity must be > 0")
    private Integer originalBatteryCapacity;

    public Device toModel() {
        return Device.builder()
                .id(this.id)
                .model(this.model)
                .manufacturer(this.manufacturer)
                .purchaseDate(Timestamps.fromInstant(this.purchaseDate))
                .purchasePrice(this.purchasePrice)
                .currentOwner(this.currentOwner)
                .storageGb(this.storageGb)
                .ramGb(this.ramGb)
                .originalBatteryCapacity(this.originalBatteryCapacity)
                .build();
    }
}
