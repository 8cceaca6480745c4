package com.loopPhones.analysis.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeuristicPricingEngineTest {

    private final HeuristicPricingEngine engine = new HeuristicPricingEngine(new Random(11));

    /** New, flawless device: every factor is 1.0 so the estimate equals the base price. */
    private static PricingInput.PricingInputBuilder pristine() {
        return PricingInput.builder()
                .deviceModel("Test Phone")
                .manufacturer("Apple")
                .ageDays(0)
                .storageGb(128)
                .ramGb(6)
                .batteryHealth(100)
                .batteryCycles(0)
                .gradeScore(4)
                .screenDamageScore(0)
                .bodyDamageScore(0);
    }

    @ParameterizedTest(name = "{0} {1}GB -> {2}")
    @CsvSource({
            "Apple, 256, 500.0",
            "Samsung, 1024, 650.0",
            "Google, 64, 180.0",
            "Nokia, 128, 280.0",
            "Apple, 32, 300.0"
    })
    void basePriceTable(String manufacturer, int storageGb, double expected) {
        PriceEstimate estimate = engine.estimate(pristine().manufacturer(manufacturer).storageGb(storageGb).build());

        assertThat(estimate.getEstimatedResalePrice()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Known original price replaces the table with 60% of it")
    void originalPriceOverridesTable() {
        PriceEstimate estimate = engine.estimate(pristine().originalPrice(1000.0).build());

        assertThat(estimate.getEstimatedResalePrice()).isEqualTo(600.0);
    }

    @Test
    @DisplayName("Age depreciation bottoms out at 30% of base")
    void ageFactorFloor() {
        PriceEstimate estimate = engine.estimate(pristine().ageDays(3650).build());

        assertThat(estimate.getEstimatedResalePrice()).isEqualTo(120.0);
    }

    @Test
    @DisplayName("High cycle counts compound the battery penalty")
    void cyclePenalties() {
        assertThat(engine.estimate(pristine().batteryCycles(600).build()).getEstimatedResalePrice())
                .isEqualTo(360.0);
        assertThat(engine.estimate(pristine().batteryCycles(1200).build()).getEstimatedResalePrice())
                .isEqualTo(306.0);
    }

    @ParameterizedTest(name = "grade score {0} -> {1}")
    @CsvSource({"4, 400.0", "3, 340.0", "2, 260.0", "1, 180.0", "0, 280.0"})
    void gradeFactors(int gradeScore, double expected) {
        PriceEstimate estimate = engine.estimate(pristine().gradeScore(gradeScore).build());

        assertThat(estimate.getEstimatedResalePrice()).isEqualTo(expected);
    }

    @Test
    @DisplayName("More damage never raises the price")
    void priceNonIncreasingInDamage() {
        double previous = Double.MAX_VALUE;
        for (int screen = 0; screen <= 10; screen++) {
            for (int body = 0; body <= 10; body++) {
                double price = engine.estimate(pristine().screenDamageScore(screen).bodyDamageScore(body).build())
                        .getEstimatedResalePrice();
                if (body == 0) {
                    assertThat(price).isLessThanOrEqualTo(previous);
                    previous = price;
                }
                double lessBody = engine.estimate(pristine().screenDamageScore(screen)
                        .bodyDamageScore(Math.max(body - 1, 0)).build()).getEstimatedResalePrice();
                assertThat(price).isLessThanOrEqualTo(lessBody);
            }
        }
    }

    @Test
    @DisplayName("Better battery health never lowers the price")
    void priceNonDecreasingInBatteryHealth() {
        double previous = -1;
        for (int health = 0; health <= 100; health += 5) {
            double price = engine.estimate(pristine().batteryHealth(health).build()).getEstimatedResalePrice();
            assertThat(price).isGreaterThanOrEqualTo(previous);
            previous = price;
        }
    }

    @Test
    @DisplayName("Interval is +/-15% and market average within the jitter band")
    void intervalAndMarketAverage() {
        PriceEstimate estimate = engine.estimate(pristine().build());

        assertThat(estimate.getConfidenceIntervalLower()).isEqualTo(340.0);
        assertThat(estimate.getConfidenceIntervalUpper()).isEqualTo(460.0);
        assertThat(estimate.getMarketAveragePrice()).isBetween(380.0, 440.0);
    }

    @Test
    void featureImportanceSumsToOne() {
        PriceEstimate estimate = engine.estimate(pristine().build());

        assertThat(estimate.getFeatureImportance().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(1.0, within(1e-9));
        assertThat(estimate.getFeatureImportance()).containsKeys("age_days", "grade_score", "battery_health");
        assertThat(estimate.getModelVersion()).isEqualTo(HeuristicPricingEngine.MODEL_VERSION);
    }

    @Test
    @DisplayName("Same seed gives the same market average")
    void deterministicJitter() {
        PricingInput input = pristine().build();

        assertThat(new HeuristicPricingEngine(new Random(5)).estimate(input).getMarketAveragePrice())
                .isEqualTo(new HeuristicPricingEngine(new Random(5)).estimate(input).getMarketAveragePrice());
    }
}
