package com.loopPhones.analysis.recommendation;

import com.loopPhones.analysis.DeviceInfo;
import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.analysis.health.HealthPrediction;
import com.loopPhones.analysis.pricing.PriceEstimate;
import com.loopPhones.model.enums.Grade;
import com.loopPhones.model.enums.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fuses health, grade and price into an ordered action list. Every matching
 * rule contributes; the first entry is the primary action.
 */
@Slf4j
@Component
public class RecommendationSynthesizer {

    public static final String IMMEDIATE_REFURBISHMENT = "immediate_refurbishment";
    public static final String SCHEDULE_MAINTENANCE = "schedule_maintenance";
    public static final String PARTS_HARVESTING = "parts_harvesting";
    public static final String RESALE = "resale";
    public static final String RECYCLING = "recycling";
    public static final String CONTINUE_MONITORING = "continue_monitoring";

    static final double RECYCLING_BASE_VALUE = 50.0;

    public RecommendationSet synthesize(DeviceInfo device, HealthPrediction health,
            GradingResult grading, PriceEstimate price) {
        List<Recommendation> recommendations = new ArrayList<>();
        Priority priority = Priority.MEDIUM;
        boolean actionRequired = false;

        int rulDays = health.getPredictedRulDays();
        double failureProbability = health.getFailureProbability();

        if (rulDays < 30) {
            recommendations.add(Recommendation.builder()
                    .action(IMMEDIATE_REFURBISHMENT)
                    .priority(Priority.HIGH)
                    .reasoning("Device has only " + rulDays + " days of estimated life remaining")
                    .estimatedValue(fractionOfPrice(price, 0.5))
                    .build());
            priority = Priority.HIGH;
            actionRequired = true;
        } else if (rulDays < 90) {
            recommendations.add(Recommendation.builder()
                    .action(SCHEDULE_MAINTENANCE)
                    .priority(Priority.MEDIUM)
                    .reasoning("Device health declining, " + rulDays + " days RUL")
                    .build());
            actionRequired = true;
        }

        if (failureProbability > 0.7) {
            recommendations.add(Recommendation.builder()
                    .action(PARTS_HARVESTING)
                    .priority(Priority.HIGH)
                    .reasoning("High failure probability (" + percent(failureProbability)
                            + "), harvest valuable components")
                    .estimatedValue(fractionOfPrice(price, 0.3))
                    .build());
            priority = Priority.HIGH;
            actionRequired = true;
        }

        Grade grade = grading == null ? null : grading.getGrade();
        if (grade == Grade.EXCELLENT) {
            recommendations.add(Recommendation.builder()
                    .action(RESALE)
                    .priority(Priority.HIGH)
                    .reasoning("Device in excellent condition, optimal for resale")
                    .estimatedValue(fractionOfPrice(price, 1.0))
                    .build());
        } else if (grade == Grade.POOR) {
            recommendations.add(Recommendation.builder()
                    .action(RECYCLING)
                    .priority(Priority.MEDIUM)
                    .reasoning("Poor condition, consider recycling for materials recovery")
                    .estimatedValue(RECYCLING_BASE_VALUE)
                    .build());
        }

        if (recommendations.isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .action(CONTINUE_MONITORING)
                    .priority(Priority.LOW)
                    .reasoning("Device in good health, continue normal operation")
                    .build());
        }

        log.debug("Device {}: {} recommendations, primary={}", device == null ? null : device.getDeviceId(),
                recommendations.size(), recommendations.get(0).getAction());

        return RecommendationSet.builder()
                .primaryAction(recommendations.get(0).getAction())
                .priority(priority)
                .actionRequired(actionRequired)
                .recommendations(recommendations)
                .summary("Device has " + rulDays + " days RUL with " + percent(failureProbability)
                        + " failure probability")
                .build();
    }

    private static Double fractionOfPrice(PriceEstimate price, double fraction) {
        return price == null ? null : price.getEstimatedResalePrice() * fraction;
    }

    private static String percent(double probability) {
        return String.format(Locale.ROOT, "%.1f%%", probability * 100.0);
    }
}
