package com.loopPhones.analysis.recommendation;

import com.loopPhones.model.enums.Priority;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Recommendation {
    String action;
    Priority priority;

    /** Null when no price estimate was available. */
    Double estimatedValue;
    String reasoning;
}
