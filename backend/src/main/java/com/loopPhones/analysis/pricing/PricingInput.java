package com.loopPhones.analysis.pricing;

import lombok.Builder;
import lombok.Value;

/** Device specs plus the fused health and grade signals the pricing engine consumes. */
@Value
@Builder
public class PricingInput {
    String deviceModel;
    String manufacturer;
    int ageDays;
    int storageGb;
    int ramGb;
    double batteryHealth;
    int batteryCycles;

    /** 4 = excellent, 3 = good, 2 = fair, 1 = poor. */
    int gradeScore;

    /** 0..10 */
    int screenDamageScore;

    /** 0..10 */
    int bodyDamageScore;

    /** Original purchase price; when present the base price is 60% of it. */
    Double originalPrice;
}
