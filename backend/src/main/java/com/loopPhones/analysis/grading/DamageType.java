package com.loopPhones.analysis.grading;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Surface damage classes and their weight in the damage score. */
public enum DamageType {
    SCREEN_SCRATCHES(3),
    SCREEN_CRACKS(15),
    BODY_SCRATCHES(2),
    BODY_DENTS(5);

    private final int weight;

    DamageType(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonValue
    public String toLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
