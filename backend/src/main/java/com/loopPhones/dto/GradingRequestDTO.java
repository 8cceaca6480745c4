package com.loopPhones.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GradingRequestDTO {
    @NotBlank(message = "Device ID is required")
    private String deviceId;

    @NotEmpty(message = "At least one image URL is required")
    private List<@NotBlank String> imageUrls;
}
