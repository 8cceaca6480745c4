package com.loopPhones.analysis.grading;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BoundingBox {
    int x;
    int y;
    int width;
    int height;
    double confidence;
}
