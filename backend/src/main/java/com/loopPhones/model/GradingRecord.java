package com.loopPhones.model;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.annotation.PropertyName;
import com.loopPhones.analysis.grading.BoundingBox;
import com.loopPhones.analysis.grading.DamageDetection;
import com.loopPhones.analysis.grading.GradingResult;
import com.loopPhones.model.enums.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradingRecord {
    private String id;

    @PropertyName("device_id")
    private String deviceId;

    private Timestamp timestamp;
    private Grade grade;

    @PropertyName("confidence_score")
    private Double confidenceScore;

    @PropertyName("screen_scratches_count")
    private Integer screenScratchesCount;

    @PropertyName("screen_cracks_count")
    private Integer screenCracksCount;

    @PropertyName("body_scratches_count")
    private Integer bodyScratchesCount;

    @PropertyName("body_dents_count")
    private Integer bodyDentsCount;

    @PropertyName("damage_score")
    private Integer damageScore;

    @PropertyName("image_urls")
    private List<String> imageUrls;

    @PropertyName("cv_model_version")
    private String cvModelVersion;

    /** Raw detector output keyed by damage type label */
    @PropertyName("detection_results")
    private Map<String, Object> detectionResults;

    public static GradingRecord fromResult(String deviceId, GradingResult result) {
        Map<String, Object> detections = new HashMap<>();
        result.getDetections().forEach((type, detection) -> detections.put(type.toLabel(), toMap(detection)));

        return GradingRecord.builder()
                .deviceId(deviceId)
                .grade(result.getGrade())
                .confidenceScore(result.getConfidenceScore())
                .screenScratchesCount(result.getScreenScratchesCount())
                .screenCracksCount(result.getScreenCracksCount())
                .bodyScratchesCount(result.getBodyScratchesCount())
                .bodyDentsCount(result.getBodyDentsCount())
                .damageScore(result.getDamageScore())
                .imageUrls(new ArrayList<>(result.getImageUrls()))
                .cvModelVersion(result.getModelVersion())
                .detectionResults(detections)
                .build();
    }

    /** Stored counts back into an engine result; detection details are not restored. */
    public GradingResult toResult() {
        return GradingResult.builder()
                .grade(grade == null ? Grade.GOOD : grade)
                .confidenceScore(confidenceScore == null ? 0.0 : confidenceScore)
                .screenScratchesCount(valueOrZero(screenScratchesCount))
                .screenCracksCount(valueOrZero(screenCracksCount))
                .bodyScratchesCount(valueOrZero(bodyScratchesCount))
                .bodyDentsCount(valueOrZero(bodyDentsCount))
                .damageScore(valueOrZero(damageScore))
                .modelVersion(cvModelVersion)
                .imageUrls(imageUrls == null ? List.of() : imageUrls)
                .build();
    }

    private static Map<String, Object> toMap(DamageDetection detection) {
        List<Map<String, Object>> boxes = new ArrayList<>();
        for (BoundingBox box : detection.getBoundingBoxes()) {
            Map<String, Object> b = new HashMap<>();
            b.put("x", box.getX());
            b.put("y", box.getY());
            b.put("width", box.getWidth());
            b.put("height", box.getHeight());
            b.put("confidence", box.getConfidence());
            boxes.add(b);
        }
        Map<String, Object> map = new HashMap<>();
        map.put("count", detection.getCount());
        map.put("confidence", detection.getConfidence());
        map.put("bounding_boxes", boxes);
        return map;
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
