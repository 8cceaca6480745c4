package com.loopPhones.controller;

import com.loopPhones.analysis.AnalysisReport;
import com.loopPhones.analysis.DeviceAnalysisService;
import com.loopPhones.analysis.recommendation.RecommendationSet;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
@Validated
public class AnalysisController {

    private final DeviceAnalysisService analysisService;

    /**
     * Full assessment. Image URLs in the body are graded fresh; without them the
     * latest stored grading is used.
     */
    @PostMapping("/{deviceId}")
    public ResponseEntity<AnalysisReport> analyze(
            @PathVariable String deviceId,
            @RequestParam(defaultValue = "true") boolean includeGrading,
            @RequestParam(defaultValue = "true") boolean includePricing,
            @RequestBody(required = false) List<String> imageUrls) {
        return ResponseEntity.ok(analysisService.analyze(deviceId, includeGrading, includePricing, imageUrls));
    }

    @GetMapping("/{deviceId}/health")
    public ResponseEntity<AnalysisReport> getHealth(@PathVariable String deviceId) {
        return ResponseEntity.ok(analysisService.analyze(deviceId, false, false, null));
    }

    @GetMapping("/{deviceId}/recommendations")
    public ResponseEntity<RecommendationSet> getRecommendations(@PathVariable String deviceId) {
        return ResponseEntity.ok(analysisService.analyze(deviceId, true, true, null).getRecommendations());
    }
}
