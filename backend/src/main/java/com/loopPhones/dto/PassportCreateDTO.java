package com.loopPhones.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PassportCreateDTO {
    @NotBlank(message = "Device ID is required")
    private String deviceId;

    @NotBlank(message = "Owner wallet address is required")
    private String ownerAddress;
}
