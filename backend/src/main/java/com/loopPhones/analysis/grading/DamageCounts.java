package com.loopPhones.analysis.grading;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@AllArgsConstructor
public class DamageCounts {
    int screenScratches;
    int screenCracks;
    int bodyScratches;
    int bodyDents;

    public static final DamageCounts NONE = new DamageCounts(0, 0, 0, 0);

    public static DamageCounts from(Map<DamageType, DamageDetection> detections) {
        return new DamageCounts(
                countOf(detections, DamageType.SCREEN_SCRATCHES),
                countOf(detections, DamageType.SCREEN_CRACKS),
                countOf(detections, DamageType.BODY_SCRATCHES),
                countOf(detections, DamageType.BODY_DENTS));
    }

    /** Weighted sum: 3 per screen scratch, 15 per crack, 2 per body scratch, 5 per dent. */
    public int damageScore() {
        return screenScratches * DamageType.SCREEN_SCRATCHES.getWeight()
                + screenCracks * DamageType.SCREEN_CRACKS.getWeight()
                + bodyScratches * DamageType.BODY_SCRATCHES.getWeight()
                + bodyDents * DamageType.BODY_DENTS.getWeight();
    }

    private static int countOf(Map<DamageType, DamageDetection> detections, DamageType type) {
        DamageDetection detection = detections == null ? null : detections.get(type);
        return detection == null ? 0 : Math.max(detection.getCount(), 0);
    }
}
