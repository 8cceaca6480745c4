package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.model.enums.DeviceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Device {
    /** IMEI or serial number, also the Firestore document id */
    private String id;
    private String model;
    private String manufacturer;

    @PropertyName("purchase_date")
    private Timestamp purchaseDate;

    @PropertyName("purchase_price")
    private Double purchasePrice;

    @PropertyName("current_owner")
    private String currentOwner;

    private DeviceStatus status;

    @PropertyName("storage_gb")
    private Integer storageGb;

    @PropertyName("ram_gb")
    private Integer ramGb;

    @PropertyName("original_battery_capacity")
    private Integer originalBatteryCapacity;

    @PropertyName("passport_id")
    private String passportId;

    @PropertyName("passport_mint_address")
    private String passportMintAddress;

    @PropertyName("created_at")
    private Timestamp createdAt;

    @PropertyName("updated_at")
    private Timestamp updatedAt;
}
