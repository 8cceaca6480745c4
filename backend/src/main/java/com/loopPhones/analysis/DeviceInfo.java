package com.loopPhones.analysis;

import com.loopPhones.model.enums.DeviceStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeviceInfo {
    String deviceId;
    String model;
    String manufacturer;
    long ageDays;
    DeviceStatus status;
}
