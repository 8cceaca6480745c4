package com.loopPhones.analysis.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Multiplicative depreciation model:
 * base price x age x battery x grade x screen penalty x body penalty.
 * The market average is the estimate with random market noise in [0.95, 1.10].
 */
@Slf4j
@Component
public class HeuristicPricingEngine implements PricingEngine {

    public static final String MODEL_VERSION = "heuristic-pricing-v1";

    static final double ORIGINAL_PRICE_RATIO = 0.6;
    static final double MIN_AGE_FACTOR = 0.30;
    static final double YEARLY_DEPRECIATION = 0.20;
    static final double CONFIDENCE_RANGE = 0.15;

    private static final Map<Integer, Double> GRADE_FACTORS = Map.of(
            4, 1.00,
            3, 0.85,
            2, 0.65,
            1, 0.45);
    private static final double UNKNOWN_GRADE_FACTOR = 0.70;

    // Static attribution, not derived from the input.
    private static final Map<String, Double> FEATURE_IMPORTANCE;

    static {
        Map<String, Double> importance = new LinkedHashMap<>();
        importance.put("age_days", 0.25);
        importance.put("grade_score", 0.20);
        importance.put("battery_health", 0.18);
        importance.put("storage_gb", 0.15);
        importance.put("screen_damage", 0.12);
        importance.put("body_damage", 0.06);
        importance.put("ram_gb", 0.04);
        FEATURE_IMPORTANCE = Collections.unmodifiableMap(importance);
    }

    private final Random random;

    public HeuristicPricingEngine(@Qualifier("pricingRandom") Random random) {
        this.random = random;
    }

    @Override
    public PriceEstimate estimate(PricingInput input) {
        double basePrice = BasePriceTable.lookup(input.getManufacturer(), input.getStorageGb());
        if (input.getOriginalPrice() != null && input.getOriginalPrice() > 0) {
            basePrice = input.getOriginalPrice() * ORIGINAL_PRICE_RATIO;
        }

        double ageYears = input.getAgeDays() / 365.0;
        double ageFactor = Math.max(MIN_AGE_FACTOR, 1.0 - ageYears * YEARLY_DEPRECIATION);

        double batteryHealth = Math.min(Math.max(input.getBatteryHealth(), 0.0), 100.0);
        double batteryFactor = batteryHealth / 100.0;
        if (input.getBatteryCycles() > 500)
            batteryFactor *= 0.90;
        if (input.getBatteryCycles() > 1000)
            batteryFactor *= 0.85;

        double gradeFactor = GRADE_FACTORS.getOrDefault(input.getGradeScore(), UNKNOWN_GRADE_FACTOR);

        double screenPenalty = 1.0 - clampDamage(input.getScreenDamageScore()) * 0.05;
        double bodyPenalty = 1.0 - clampDamage(input.getBodyDamageScore()) * 0.03;

        double estimated = basePrice * ageFactor * batteryFactor * gradeFactor * screenPenalty * bodyPenalty;
        double marketAverage = estimated * (0.95 + random.nextDouble() * 0.15);
        double range = estimated * CONFIDENCE_RANGE;

        log.debug("Pricing {} {}: base={}, age={}, battery={}, grade={}, screen={}, body={}",
                input.getManufacturer(), input.getDeviceModel(), basePrice, ageFactor, batteryFactor,
                gradeFactor, screenPenalty, bodyPenalty);

        return PriceEstimate.builder()
                .estimatedResalePrice(roundMoney(estimated))
                .marketAveragePrice(roundMoney(marketAverage))
                .confidenceIntervalLower(roundMoney(estimated - range))
                .confidenceIntervalUpper(roundMoney(estimated + range))
                .modelVersion(MODEL_VERSION)
                .featureImportance(FEATURE_IMPORTANCE)
                .build();
    }

    private static int clampDamage(int score) {
        return Math.min(Math.max(score, 0), 10);
    }

    private static double roundMoney(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
