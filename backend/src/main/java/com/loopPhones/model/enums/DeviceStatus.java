package com.loopPhones.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeviceStatus {
    ACTIVE,
    GRADED,
    REFURBISHED,
    RECYCLED,
    PARTS_HARVESTED;

    /** Label used on the API ("active", "parts_harvested", ...) */
    @JsonValue
    public String toLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeviceStatus fromLabel(String label) {
        if (label == null)
            return null;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown device status: " + label);
        }
    }
}
