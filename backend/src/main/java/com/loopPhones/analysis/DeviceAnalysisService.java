package com.loopPhones.analysis;

import com.loopPhones.analysis.grading.GradingEngine;
import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.analysis.health.HealthPrediction;
import com.loopPhones.analysis.health.HealthPredictor;
import com.loopPhones.analysis.health.HeuristicHealthPredictor;
import com.loopPhones.analysis.health.TelemetryReading;
import com.loopPhones.analysis.pricing.HeuristicPricingEngine;
import com.loopPhones.analysis.pricing.PriceEstimate;
import com.loopPhones.analysis.pricing.PricingEngine;
import com.loopPhones.analysis.pricing.PricingInput;
import com.loopPhones.analysis.recommendation.RecommendationSet;
import com.loopPhones.analysis.recommendation.RecommendationSynthesizer;
import com.loopPhones.exception.InvalidInputException;
import com.loopPhones.exception.ModelUnavailableException;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.Device;
import com.loopPhones.model.GradingRecord;
import com.loopPhones.model.PriceEstimateRecord;
import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.service.DeviceService;
import com.loopPhones.service.GradingRecordService;
import com.loopPhones.service.PriceEstimateService;
import com.loopPhones.service.TelemetryService;
import com.loopPhones.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs a full device assessment: health and grading in parallel, then pricing
 * on the fused signals, then recommendations.
 *
 * <p>Failure policy: a missing device is terminal. A primary predictor that
 * reports {@link ModelUnavailableException} is replaced by its heuristic and the
 * stage is listed in {@link AnalysisReport#getDegradedStages()}; a failing
 * heuristic fails the request. Grading has no heuristic, so any grading failure
 * yields the default grading and pricing continues with default grade inputs.
 */
@Slf4j
@Service
public class DeviceAnalysisService {

    static final int DEFAULT_STORAGE_GB = 128;
    static final int DEFAULT_RAM_GB = 6;
    static final double DEFAULT_BATTERY_HEALTH = 85.0;
    static final int DEFAULT_BATTERY_CYCLES = 100;
    static final int DEFAULT_GRADE_SCORE = 3;
    static final int MAX_DAMAGE_SCORE = 10;

    private final DeviceService deviceService;
    private final TelemetryService telemetryService;
    private final GradingRecordService gradingRecordService;
    private final PriceEstimateService priceEstimateService;
    private final HealthPredictor healthPredictor;
    private final HeuristicHealthPredictor heuristicHealthPredictor;
    private final GradingEngine gradingEngine;
    private final PricingEngine pricingEngine;
    private final HeuristicPricingEngine heuristicPricingEngine;
    private final RecommendationSynthesizer recommendationSynthesizer;
    private final Executor analysisExecutor;
    private final Clock clock;
    private final int telemetryLookbackDays;
    private final int telemetryMaxSnapshots;

    public DeviceAnalysisService(DeviceService deviceService,
            TelemetryService telemetryService,
            GradingRecordService gradingRecordService,
            PriceEstimateService priceEstimateService,
            HealthPredictor healthPredictor,
            HeuristicHealthPredictor heuristicHealthPredictor,
            GradingEngine gradingEngine,
            PricingEngine pricingEngine,
            HeuristicPricingEngine heuristicPricingEngine,
            RecommendationSynthesizer recommendationSynthesizer,
            @Qualifier("analysisExecutor") Executor analysisExecutor,
            Clock clock,
            @Value("${analysis.telemetry-lookback-days:30}") int telemetryLookbackDays,
            @Value("${analysis.telemetry-max-snapshots:30}") int telemetryMaxSnapshots) {
        this.deviceService = deviceService;
        this.telemetryService = telemetryService;
        this.gradingRecordService = gradingRecordService;
        this.priceEstimateService = priceEstimateService;
        this.healthPredictor = healthPredictor;
        this.heuristicHealthPredictor = heuristicHealthPredictor;
        this.gradingEngine = gradingEngine;
        this.pricingEngine = pricingEngine;
        this.heuristicPricingEngine = heuristicPricingEngine;
        this.recommendationSynthesizer = recommendationSynthesizer;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
        this.telemetryLookbackDays = telemetryLookbackDays;
        this.telemetryMaxSnapshots = telemetryMaxSnapshots;
    }

    public AnalysisReport analyze(String deviceId, boolean includeGrading, boolean includePricing,
            List<String> imageUrls) {
        log.info("Starting analysis for device {}", deviceId);

        Device device = deviceService.getDeviceById(deviceId);
        Instant now = clock.instant();
        DeviceInfo deviceInfo = DeviceInfo.builder()
                .deviceId(deviceId)
                .model(device.getModel())
                .manufacturer(device.getManufacturer())
                .ageDays(ageDays(device, now))
                .status(device.getStatus())
                .build();

        List<TelemetrySnapshot> snapshots = telemetryService.getAnalysisWindow(
                deviceId, now.minus(Duration.ofDays(telemetryLookbackDays)), telemetryMaxSnapshots);
        List<TelemetryReading> history = snapshots.stream()
                .map(TelemetrySnapshot::toReading)
                .collect(Collectors.toList());

        List<String> degradedStages = new CopyOnWriteArrayList<>();

        CompletableFuture<HealthPrediction> healthTask = CompletableFuture.supplyAsync(
                () -> predictHealth(history, degradedStages), analysisExecutor);
        CompletableFuture<GradingResult> gradingTask = includeGrading
                ? CompletableFuture.supplyAsync(() -> resolveGrading(deviceId, imageUrls, degradedStages), analysisExecutor)
                : CompletableFuture.completedFuture(null);

        HealthPrediction health = join(healthTask);
        GradingResult grading = join(gradingTask);

        PriceEstimate price = null;
        if (includePricing) {
            price = estimatePrice(device, deviceInfo.getAgeDays(), latest(snapshots), grading, degradedStages);
        }

        RecommendationSet recommendations = recommendationSynthesizer.synthesize(deviceInfo, health, grading, price);

        if (!degradedStages.isEmpty()) {
            log.warn("Analysis for device {} used fallbacks for: {}", deviceId, degradedStages);
        }
        log.info("Analysis complete for device {}: primary action {}", deviceId, recommendations.getPrimaryAction());

        return AnalysisReport.builder()
                .deviceId(deviceId)
                .timestamp(now)
                .deviceInfo(deviceInfo)
                .healthPrediction(health)
                .grading(grading)
                .priceEstimate(price)
                .recommendations(recommendations)
                .degradedStages(degradedStages)
                .build();
    }

    private HealthPrediction predictHealth(List<TelemetryReading> history, List<String> degradedStages) {
        try {
            return healthPredictor.predict(history);
        } catch (ModelUnavailableException e) {
            log.warn("Health model unavailable, using heuristic: {}", e.getMessage());
            degradedStages.add("health");
        }
        try {
            return heuristicHealthPredictor.predict(history);
        } catch (RuntimeException e) {
            throw new ServiceException("Health prediction failed", e);
        }
    }

    /**
     * Fresh images are graded and stored; otherwise the most recent stored grading
     * is reused, and a device never graded gets the default grading. Null and
     * blank image references are dropped before grading.
     */
    private GradingResult resolveGrading(String deviceId, List<String> imageUrls, List<String> degradedStages) {
        List<String> imageRefs = usableImageRefs(deviceId, imageUrls);
        if (!imageRefs.isEmpty()) {
            GradingResult result;
            try {
                result = gradingEngine.grade(imageRefs);
            } catch (RuntimeException e) {
                log.warn("Grading failed for device {}, using default grading: {}", deviceId, e.getMessage());
                degradedStages.add("grading");
                return gradingEngine.defaultGrading();
            }
            try {
                gradingRecordService.save(GradingRecord.fromResult(deviceId, result));
            } catch (ServiceException e) {
                log.warn("Grading record for device {} not stored: {}", deviceId, e.getMessage());
                degradedStages.add("grading_record");
            }
            return result;
        }

        try {
            Optional<GradingRecord> latest = gradingRecordService.findLatest(deviceId);
            return latest.map(GradingRecord::toResult).orElseGet(gradingEngine::defaultGrading);
        } catch (ServiceException e) {
            log.warn("Stored grading for device {} unavailable, using default grading: {}", deviceId, e.getMessage());
            degradedStages.add("grading");
            return gradingEngine.defaultGrading();
        }
    }

    private static List<String> usableImageRefs(String deviceId, List<String> imageUrls) {
        if (imageUrls == null || imageUrls.isEmpty()) {
            return List.of();
        }
        List<String> refs = imageUrls.stream()
                .filter(url -> url != null && !url.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        if (refs.size() < imageUrls.size()) {
            log.warn("Ignoring {} blank image reference(s) for device {}", imageUrls.size() - refs.size(), deviceId);
        }
        return refs;
    }

    private PriceEstimate estimatePrice(Device device, long ageDays, TelemetrySnapshot latestTelemetry,
            GradingResult grading, List<String> degradedStages) {
        PricingInput input = pricingInput(device, ageDays, latestTelemetry, grading);

        PriceEstimate estimate;
        try {
            estimate = pricingEngine.estimate(input);
        } catch (ModelUnavailableException e) {
            log.warn("Pricing model unavailable, using heuristic: {}", e.getMessage());
            degradedStages.add("pricing");
            try {
                estimate = heuristicPricingEngine.estimate(input);
            } catch (RuntimeException fallbackError) {
                throw new ServiceException("Price estimation failed", fallbackError);
            }
        }

        try {
            priceEstimateService.save(PriceEstimateRecord.fromEstimate(device.getId(), estimate));
        } catch (ServiceException e) {
            log.warn("Price estimate for device {} not stored: {}", device.getId(), e.getMessage());
            degradedStages.add("price_record");
        }
        return estimate;
    }

    PricingInput pricingInput(Device device, long ageDays, TelemetrySnapshot latestTelemetry, GradingResult grading) {
        double batteryHealth = DEFAULT_BATTERY_HEALTH;
        int batteryCycles = DEFAULT_BATTERY_CYCLES;
        if (latestTelemetry != null) {
            if (latestTelemetry.getBatteryHealthPercentage() != null)
                batteryHealth = latestTelemetry.getBatteryHealthPercentage();
            if (latestTelemetry.getBatteryCycleCount() != null)
                batteryCycles = latestTelemetry.getBatteryCycleCount();
        }

        int gradeScore = DEFAULT_GRADE_SCORE;
        int screenDamage = 0;
        int bodyDamage = 0;
        if (grading != null) {
            if (grading.getGrade() != null)
                gradeScore = grading.getGrade().getScore();
            screenDamage = grading.getScreenScratchesCount() * 2 + grading.getScreenCracksCount() * 5;
            bodyDamage = grading.getBodyScratchesCount() + grading.getBodyDentsCount() * 3;
        }

        return PricingInput.builder()
                .deviceModel(device.getModel())
                .manufacturer(device.getManufacturer())
                .ageDays((int) ageDays)
                .storageGb(device.getStorageGb() == null ? DEFAULT_STORAGE_GB : device.getStorageGb())
                .ramGb(device.getRamGb() == null ? DEFAULT_RAM_GB : device.getRamGb())
                .batteryHealth(batteryHealth)
                .batteryCycles(batteryCycles)
                .gradeScore(gradeScore)
                .screenDamageScore(Math.min(screenDamage, MAX_DAMAGE_SCORE))
                .bodyDamageScore(Math.min(bodyDamage, MAX_DAMAGE_SCORE))
                .originalPrice(device.getPurchasePrice())
                .build();
    }

    private static long ageDays(Device device, Instant now) {
        Instant purchaseDate = Timestamps.toInstant(device.getPurchaseDate());
        if (purchaseDate == null) {
            throw new InvalidInputException("Device " + device.getId() + " has no purchase date");
        }
        long days = Duration.between(purchaseDate, now).toDays();
        if (days < 0) {
            throw new InvalidInputException("Device " + device.getId() + " has a purchase date in the future");
        }
        return days;
    }

    private static TelemetrySnapshot latest(List<TelemetrySnapshot> snapshots) {
        return snapshots.stream()
                .max(Comparator.comparing(s -> Optional.ofNullable(Timestamps.toInstant(s.getTimestamp()))
                        .orElse(Instant.MIN)))
                .orElse(null);
    }

    private static <T> T join(CompletableFuture<T> task) {
        try {
            return task.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new ServiceException("Analysis stage failed", e.getCause());
        }
    }
}
