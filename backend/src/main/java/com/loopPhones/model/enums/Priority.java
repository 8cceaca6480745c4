package com.loopPhones.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String toLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
