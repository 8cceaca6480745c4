package com.loopPhones.analysis.pricing;

public interface PricingEngine {

    PriceEstimate estimate(PricingInput input);
}
