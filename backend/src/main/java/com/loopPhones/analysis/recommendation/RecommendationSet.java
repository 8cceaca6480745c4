package com.loopPhones.analysis.recommendation;

import com.loopPhones.model.enums.Priority;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RecommendationSet {
    String primaryAction;
    Priority priority;
    boolean actionRequired;

    @Singular
    List<Recommendation> recommendations;

    String summary;
}
