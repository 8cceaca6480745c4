package com.loopPhones.analysis;

import com.loopPhones.analysis.grading.DamageCounts;
import com.loopPhones.analysis.grading.DamageDetection;
import com.loopPhones.analysis.grading.DamageDetector;
import com.loopPhones.analysis.grading.DamageType;
import com.loopPhones.analysis.grading.GradingEngine;
import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.analysis.grading.SimulatedDamageDetector;
import com.loopPhones.analysis.health.HealthPredictor;
import com.loopPhones.analysis.health.HeuristicHealthPredictor;
import com.loopPhones.analysis.health.TelemetryFeatureExtractor;
import com.loopPhones.analysis.pricing.HeuristicPricingEngine;
import com.loopPhones.analysis.pricing.PricingEngine;
import com.loopPhones.analysis.pricing.PricingInput;
import com.loopPhones.analysis.recommendation.Recommendation;
import com.loopPhones.analysis.recommendation.RecommendationSynthesizer;
import com.loopPhones.exception.InvalidInputException;
import com.loopPhones.exception.ModelUnavailableException;
import com.loopPhones.exception.ResourceNotFoundException;
import com.loopPhones.exception.ServiceException;
import com.loopPhones.model.Device;
import com.loopPhones.model.GradingRecord;
import com.loopPhones.model.PriceEstimateRecord;
import com.loopPhones.model.TelemetrySnapshot;
import com.loopPhones.model.enums.DeviceStatus;
import com.loopPhones.model.enums.Grade;
import com.loopPhones.model.enums.Priority;
import com.loopPhones.service.DeviceService;
import com.loopPhones.service.GradingRecordService;
import com.loopPhones.service.PriceEstimateService;
import com.loopPhones.service.TelemetryService;
import com.loopPhones.util.Timestamps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant WINDOW_START = NOW.minus(30, ChronoUnit.DAYS);
    private static final String DEVICE_ID = "356938035643809";

    @Mock
    private DeviceService deviceService;
    @Mock
    private TelemetryService telemetryService;
    @Mock
    private GradingRecordService gradingRecordService;
    @Mock
    private PriceEstimateService priceEstimateService;

    private final HeuristicHealthPredictor heuristicHealth = new HeuristicHealthPredictor(new TelemetryFeatureExtractor());
    private final HeuristicPricingEngine heuristicPricing = new HeuristicPricingEngine(new Random(17));
    private final GradingEngine gradingEngine = new GradingEngine(new SimulatedDamageDetector(new Random(17)));

    private DeviceAnalysisService service;

    @BeforeEach
    void setUp() {
        service = newService(heuristicHealth, heuristicPricing, gradingEngine);
    }

    private DeviceAnalysisService newService(HealthPredictor healthPredictor, PricingEngine pricingEngine,
            GradingEngine engine) {
        return new DeviceAnalysisService(deviceService, telemetryService, gradingRecordService,
                priceEstimateService, healthPredictor, heuristicHealth, engine, pricingEngine, heuristicPricing,
                new RecommendationSynthesizer(), Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC), 30, 30);
    }

    private static Device device(Instant purchaseDate) {
        return Device.builder()
                .id(DEVICE_ID)
                .model("iPhone 13")
                .manufacturer("Apple")
                .purchaseDate(Timestamps.fromInstant(purchaseDate))
                .status(DeviceStatus.ACTIVE)
                .storageGb(128)
                .ramGb(4)
                .build();
    }

    private static TelemetrySnapshot worn() {
        return TelemetrySnapshot.builder()
                .deviceId(DEVICE_ID)
                .timestamp(Timestamps.fromInstant(NOW.minus(1, ChronoUnit.DAYS)))
                .batteryHealthPercentage(15.0)
                .batteryCycleCount(1200)
                .batteryTemperature(42.0)
                .thermalEventsCount(12)
                .crashCount(6)
                .build();
    }

    @Test
    @DisplayName("New device without telemetry or photos: defaults everywhere, keep monitoring")
    void newDeviceWithoutData() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(365, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        when(gradingRecordService.findLatest(DEVICE_ID)).thenReturn(Optional.empty());

        AnalysisReport report = service.analyze(DEVICE_ID, true, true, null);

        assertThat(report.getDeviceId()).isEqualTo(DEVICE_ID);
        assertThat(report.getTimestamp()).isEqualTo(NOW);
        assertThat(report.getDeviceInfo().getAgeDays()).isEqualTo(365);
        assertThat(report.getHealthPrediction().getPredictedRulDays()).isEqualTo(365);
        assertThat(report.getHealthPrediction().getFailureProbability()).isEqualTo(0.1);
        assertThat(report.getGrading().getGrade()).isEqualTo(Grade.GOOD);
        // 400 base x 0.80 age x 0.85 battery x 0.85 grade
        assertThat(report.getPriceEstimate().getEstimatedResalePrice()).isCloseTo(231.2, within(0.01));
        assertThat(report.getRecommendations().getPrimaryAction())
                .isEqualTo(RecommendationSynthesizer.CONTINUE_MONITORING);
        assertThat(report.getRecommendations().isActionRequired()).isFalse();
        assertThat(report.getDegradedStages()).isEmpty();
        verify(priceEstimateService).save(any(PriceEstimateRecord.class));
        verify(gradingRecordService, never()).save(any());
    }

    @Test
    @DisplayName("Worn, overheating device: maintenance and parts harvesting at high priority")
    void degradedDevice() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(900, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of(worn()));

        AnalysisReport report = service.analyze(DEVICE_ID, false, true, null);

        assertThat(report.getHealthPrediction().getDegradationRate()).isEqualTo(0.172);
        assertThat(report.getHealthPrediction().getPredictedRulDays()).isEqualTo(87);
        assertThat(report.getHealthPrediction().getFailureProbability()).isEqualTo(1.0);
        assertThat(report.getGrading()).isNull();
        assertThat(report.getRecommendations().getRecommendations())
                .extracting(Recommendation::getAction)
                .containsExactly(RecommendationSynthesizer.SCHEDULE_MAINTENANCE,
                        RecommendationSynthesizer.PARTS_HARVESTING);
        assertThat(report.getRecommendations().getPriority()).isEqualTo(Priority.HIGH);
        verifyNoInteractions(gradingRecordService);
    }

    @Test
    @DisplayName("Telemetry and grading signals map onto the pricing input, damage capped at 10")
    void pricingInputUsesLatestSignals() {
        Device device = device(NOW.minus(100, ChronoUnit.DAYS));
        GradingResult grading = gradingEngine.fromCounts(new DamageCounts(3, 1, 4, 3), "test");

        PricingInput input = service.pricingInput(device, 100, worn(), grading);

        assertThat(input.getBatteryHealth()).isEqualTo(15.0);
        assertThat(input.getBatteryCycles()).isEqualTo(1200);
        assertThat(input.getGradeScore()).isEqualTo(Grade.POOR.getScore());
        // 2*3 + 5*1 = 11, capped
        assertThat(input.getScreenDamageScore()).isEqualTo(10);
        // 4 + 3*3 = 13, capped
        assertThat(input.getBodyDamageScore()).isEqualTo(10);
        assertThat(input.getStorageGb()).isEqualTo(128);
        assertThat(input.getOriginalPrice()).isNull();
    }

    @Test
    @DisplayName("Fresh photos are graded and stored")
    void gradesFreshImages() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(30, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());

        AnalysisReport report = service.analyze(DEVICE_ID, true, false, List.of("front.jpg", "back.jpg"));

        assertThat(report.getGrading().getImageUrls()).containsExactly("front.jpg", "back.jpg");
        assertThat(report.getGrading().getModelVersion()).isEqualTo(SimulatedDamageDetector.MODEL_VERSION);
        assertThat(report.getPriceEstimate()).isNull();
        verify(gradingRecordService).save(any(GradingRecord.class));
        verify(gradingRecordService, never()).findLatest(DEVICE_ID);
    }

    @Test
    @DisplayName("Blank photo references are dropped; none left means no fresh grading is stored")
    void blankImageRefsFallBackToDefaultGrading() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(30, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        when(gradingRecordService.findLatest(DEVICE_ID)).thenReturn(Optional.empty());

        AnalysisReport report = service.analyze(DEVICE_ID, true, false, Arrays.asList("", "   ", null));

        assertThat(report.getGrading().getGrade()).isEqualTo(Grade.GOOD);
        assertThat(report.getGrading().getModelVersion()).isEqualTo(GradingEngine.DEFAULT_MODEL_VERSION);
        assertThat(report.getDegradedStages()).isEmpty();
        verify(gradingRecordService, never()).save(any());
    }

    @Test
    @DisplayName("Only usable photo references reach the detector")
    void mixedImageRefsGradeOnlyUsableOnes() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(30, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());

        AnalysisReport report = service.analyze(DEVICE_ID, true, false, Arrays.asList("", " front.jpg ", null));

        assertThat(report.getGrading().getImageUrls()).containsExactly("front.jpg");
        verify(gradingRecordService).save(any(GradingRecord.class));
    }

    @Test
    @DisplayName("Telemetry window starts at the lookback measured from the injected clock")
    void telemetryWindowUsesInjectedClock() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(30, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());

        service.analyze(DEVICE_ID, false, false, null);

        verify(telemetryService).getAnalysisWindow(DEVICE_ID, Instant.parse("2024-05-02T12:00:00Z"), 30);
    }

    @Test
    @DisplayName("Stored grading is reused when no photos are supplied")
    void reusesStoredGrading() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(30, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        GradingRecord stored = GradingRecord.builder()
                .deviceId(DEVICE_ID)
                .grade(Grade.EXCELLENT)
                .confidenceScore(0.95)
                .screenScratchesCount(0)
                .screenCracksCount(0)
                .bodyScratchesCount(0)
                .bodyDentsCount(0)
                .damageScore(0)
                .cvModelVersion("simulated-detector-v1")
                .build();
        when(gradingRecordService.findLatest(DEVICE_ID)).thenReturn(Optional.of(stored));

        AnalysisReport report = service.analyze(DEVICE_ID, true, true, List.of());

        assertThat(report.getGrading().getGrade()).isEqualTo(Grade.EXCELLENT);
        assertThat(report.getRecommendations().getPrimaryAction()).isEqualTo(RecommendationSynthesizer.RESALE);
        assertThat(report.getRecommendations().getRecommendations().get(0).getEstimatedValue())
                .isEqualTo(report.getPriceEstimate().getEstimatedResalePrice());
    }

    @Test
    @DisplayName("Unavailable health model falls back to the heuristic and flags the stage")
    void healthModelFallback() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(900, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of(worn()));
        HealthPredictor unavailable = history -> {
            throw new ModelUnavailableException("model not loaded");
        };

        AnalysisReport report = newService(unavailable, heuristicPricing, gradingEngine)
                .analyze(DEVICE_ID, false, false, null);

        assertThat(report.getHealthPrediction().getModelVersion()).isEqualTo(HeuristicHealthPredictor.MODEL_VERSION);
        assertThat(report.getHealthPrediction().getPredictedRulDays()).isEqualTo(87);
        assertThat(report.getDegradedStages()).containsExactly("health");
    }

    @Test
    @DisplayName("Unavailable pricing model falls back to the heuristic")
    void pricingModelFallback() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(365, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        PricingEngine unavailable = input -> {
            throw new ModelUnavailableException("pricing model offline");
        };

        AnalysisReport report = newService(heuristicHealth, unavailable, gradingEngine)
                .analyze(DEVICE_ID, false, true, null);

        assertThat(report.getPriceEstimate().getModelVersion()).isEqualTo(HeuristicPricingEngine.MODEL_VERSION);
        assertThat(report.getDegradedStages()).containsExactly("pricing");
    }

    @Test
    @DisplayName("Detector failure degrades to the default grade and pricing still runs")
    void gradingFailureDoesNotAbortPricing() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(365, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        DamageDetector broken = new DamageDetector() {
            @Override
            public Map<DamageType, DamageDetection> detect(List<String> imageRefs) {
                throw new IllegalStateException("camera pipeline down");
            }

            @Override
            public String getModelVersion() {
                return "broken";
            }
        };

        AnalysisReport report = newService(heuristicHealth, heuristicPricing, new GradingEngine(broken))
                .analyze(DEVICE_ID, true, true, List.of("front.jpg"));

        assertThat(report.getGrading().getGrade()).isEqualTo(Grade.GOOD);
        assertThat(report.getGrading().getModelVersion()).isEqualTo(GradingEngine.DEFAULT_MODEL_VERSION);
        assertThat(report.getPriceEstimate().getEstimatedResalePrice()).isCloseTo(231.2, within(0.01));
        assertThat(report.getDegradedStages()).containsExactly("grading");
        verify(gradingRecordService, never()).save(any());
    }

    @Test
    @DisplayName("Failing to store the price estimate is reported but not fatal")
    void priceRecordFailureIsNotFatal() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(365, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        when(priceEstimateService.save(any())).thenThrow(new ServiceException("firestore down"));

        AnalysisReport report = service.analyze(DEVICE_ID, false, true, null);

        assertThat(report.getPriceEstimate()).isNotNull();
        assertThat(report.getDegradedStages()).containsExactly("price_record");
    }

    @Test
    @DisplayName("Unknown device stops the analysis before any telemetry is read")
    void unknownDevice() {
        when(deviceService.getDeviceById("missing")).thenThrow(new ResourceNotFoundException("Device", "missing"));

        assertThatThrownBy(() -> service.analyze("missing", true, true, null))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(telemetryService, never()).getAnalysisWindow(eq("missing"), any(Instant.class), anyInt());
    }

    @Test
    @DisplayName("Purchase date in the future is rejected")
    void negativeAge() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.plus(3, ChronoUnit.DAYS)));

        assertThatThrownBy(() -> service.analyze(DEVICE_ID, false, false, null))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(telemetryService);
    }

    @Test
    @DisplayName("Stages run on the injected executor")
    void runsOnExecutor() {
        when(deviceService.getDeviceById(DEVICE_ID)).thenReturn(device(NOW.minus(10, ChronoUnit.DAYS)));
        when(telemetryService.getAnalysisWindow(DEVICE_ID, WINDOW_START, 30)).thenReturn(List.of());
        when(gradingRecordService.findLatest(DEVICE_ID)).thenReturn(Optional.empty());
        int[] tasks = {0};
        DeviceAnalysisService counting = new DeviceAnalysisService(deviceService, telemetryService,
                gradingRecordService, priceEstimateService, heuristicHealth, heuristicHealth, gradingEngine,
                heuristicPricing, heuristicPricing, new RecommendationSynthesizer(),
                runnable -> {
                    tasks[0]++;
                    runnable.run();
                }, Clock.fixed(NOW, ZoneOffset.UTC), 30, 30);

        counting.analyze(DEVICE_ID, true, false, null);

        assertThat(tasks[0]).isEqualTo(2);
        verify(gradingRecordService, never()).save(any());
    }
}
