package com.loopPhones.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cosmetic condition bucket. The numeric score (4 = excellent ... 1 = poor) is
 * the form the pricing engine consumes.
 */
public enum Grade {
    EXCELLENT(4),
    GOOD(3),
    FAIR(2),
    POOR(1);

    private final int score;

    Grade(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    @JsonValue
    public String toLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Grade fromLabel(String label) {
        if (label == null)
            return null;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "excellent" -> EXCELLENT;
            case "good" -> GOOD;
            case "fair" -> FAIR;
            case "poor" -> POOR;
            default -> throw new IllegalArgumentException("Unknown grade: " + label);
        };
    }
}
