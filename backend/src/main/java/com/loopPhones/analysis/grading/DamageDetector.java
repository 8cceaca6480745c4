package com.loopPhones.analysis.grading;

import java.util.List;
import java.util.Map;

/**
 * Object detection over device photos. Returns one entry per damage type found;
 * missing types count as zero. Throws
 * {@link com.loopPhones.exception.ModelUnavailableException} when the model cannot run.
 */
public interface DamageDetector {

    Map<DamageType, DamageDetection> detect(List<String> imageRefs);

    String getModelVersion();
}
