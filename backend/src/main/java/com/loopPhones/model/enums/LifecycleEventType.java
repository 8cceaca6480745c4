package com.loopPhones.model.enums;

import java.util.Locale;
import java.util.Optional;

/** Event types that move a passport counter. Any other type is only logged to history. */
public enum LifecycleEventType {
    REPAIR,
    REFURBISHMENT,
    PARTS_HARVESTED,
    RECYCLING;

    public String toLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LifecycleEventType> fromLabel(String label) {
        if (label == null)
            return Optional.empty();
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "repair" -> Optional.of(REPAIR);
            case "refurbishment" -> Optional.of(REFURBISHMENT);
            case "parts_harvested" -> Optional.of(PARTS_HARVESTED);
            case "recycling" -> Optional.of(RECYCLING);
            default -> Optional.empty();
        };
    }
}
