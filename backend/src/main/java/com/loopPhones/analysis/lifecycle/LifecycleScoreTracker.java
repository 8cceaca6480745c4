package com.loopPhones.analysis.lifecycle;

import com.loopPhones.exception.InvalidInputException;
import com.loopPhones.model.enums.LifecycleEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Pure state transition for passport scores. Each recognized event bumps its
 * counter, then circularity and carbon footprint are recomputed with the usage
 * years at the moment of that event:
 * <pre>
 *   circularity = min(100, 70 + 5*repairs + 10*refurbishments + 8*partsHarvested
 *                          + 15*recycling + floor(usageYears))
 *   carbon      = max(0, 70 + 5 + 2*usageYears - 5*repairs - 30*refurbishments - 15*partsHarvested)
 * </pre>
 * Recycling does not lower the footprint.
 */
@Slf4j
@Component
public class LifecycleScoreTracker {

    public static final int BASE_CIRCULARITY_SCORE = 70;
    public static final int MAX_CIRCULARITY_SCORE = 100;
    public static final double MANUFACTURING_EMISSIONS = 70.0;
    public static final double TRANSPORT_EMISSIONS = 5.0;
    public static final double USAGE_EMISSIONS_PER_YEAR = 2.0;

    /** Usage assumed when a passport is first minted. */
    static final double INITIAL_USAGE_YEARS = 1.0;

    public PassportLifecycleState initialState(LifecycleEvent mintEvent) {
        return PassportLifecycleState.builder()
                .circularityScore(BASE_CIRCULARITY_SCORE)
                .carbonFootprint(carbonFootprint(INITIAL_USAGE_YEARS, 0, 0, 0))
                .event(mintEvent)
                .build();
    }

    public PassportLifecycleState apply(PassportLifecycleState state, LifecycleEvent event, Instant purchaseDate) {
        if (event.getTimestamp() == null) {
            throw new InvalidInputException("Lifecycle event has no timestamp");
        }

        int repairs = state.getTotalRepairs();
        int refurbishments = state.getTotalRefurbishments();
        int partsHarvested = state.getPartsHarvested();
        int recycling = state.getRecyclingEvents();

        Optional<LifecycleEventType> type = LifecycleEventType.fromLabel(event.getEventType());
        if (type.isPresent()) {
            switch (type.get()) {
                case REPAIR -> repairs++;
                case REFURBISHMENT -> refurbishments++;
                case PARTS_HARVESTED -> partsHarvested++;
                case RECYCLING -> recycling++;
            }
        } else {
            log.info("Lifecycle event type '{}' does not affect counters, appended to history only", event.getEventType());
        }

        double usageYears = usageYears(purchaseDate, event.getTimestamp());

        return state.toBuilder()
                .totalRepairs(repairs)
                .totalRefurbishments(refurbishments)
                .partsHarvested(partsHarvested)
                .recyclingEvents(recycling)
                .circularityScore(circularityScore(repairs, refurbishments, partsHarvested, recycling, usageYears))
                .carbonFootprint(carbonFootprint(usageYears, repairs, refurbishments, partsHarvested))
                .event(event)
                .build();
    }

    public int circularityScore(int repairs, int refurbishments, int partsHarvested, int recycling,
            double usageYears) {
        int score = BASE_CIRCULARITY_SCORE
                + repairs * 5
                + refurbishments * 10
                + partsHarvested * 8
                + recycling * 15
                + (int) Math.floor(usageYears);
        return Math.min(score, MAX_CIRCULARITY_SCORE);
    }

    public double carbonFootprint(double usageYears, int repairs, int refurbishments, int partsHarvested) {
        double total = MANUFACTURING_EMISSIONS + TRANSPORT_EMISSIONS;
        total += usageYears * USAGE_EMISSIONS_PER_YEAR;
        total -= repairs * 5.0;
        total -= refurbishments * 30.0;
        total -= partsHarvested * 15.0;
        return Math.max(total, 0.0);
    }

    /** Whole days of use divided by 365. */
    public double usageYears(Instant purchaseDate, Instant at) {
        if (purchaseDate == null) {
            throw new InvalidInputException("Device purchase date is missing");
        }
        long days = Duration.between(purchaseDate, at).toDays();
        if (days < 0) {
            throw new InvalidInputException("Event at " + at + " precedes purchase date " + purchaseDate);
        }
        return days / 365.0;
    }
}
