package com.loopPhones.analysis.grading;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DamageDetection {
    int count;
    double confidence;

    @Singular
    List<BoundingBox> boundingBoxes;
}
