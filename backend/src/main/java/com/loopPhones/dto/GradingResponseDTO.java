package com.loopPhones.dto;

import com.loopPhones.model.GradingRecord;
import com.loopPhones.model.enums.Grade;
import com.loopPhones.util.Timestamps;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GradingResponseDTO {
    private String id;
    private String deviceId;
    private Instant timestamp;
    private Grade grade;
    private Double confidenceScore;
    private Integer screenScratchesCount;
    private Integer screenCracksCount;
    private Integer bodyScratchesCount;
    private Integer bodyDentsCount;
    private Integer damageScore;
    private List<String> imageUrls;
    private String cvModelVersion;
    private Map<String, Object> detectionResults;

    public static GradingResponseDTO fromModel(GradingRecord record) {
        if (record == null)
            return null;
        return GradingResponseDTO.builder()
                .id(record.getId())
                .deviceId(record.getDeviceId())
                .timestamp(Timestamps.toInstant(record.getTimestamp()))
                .grade(record.getGrade())
                .confidenceScore(record.getConfidenceScore())
                .screenScratchesCount(record.getScreenScratchesCount())
                .screenCracksCount(record.getScreenCracksCount())
                .bodyScratchesCount(record.getBodyScratchesCount())
                .bodyDentsCount(record.getBodyDentsCount())
                .damageScore(record.getDamageScore())
                .imageUrls(record.getImageUrls())
                .cvModelVersion(record.getCvModelVersion())
                .detectionResults(record.getDetectionResults())
                .build();
    }
}
