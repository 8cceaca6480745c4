package com.loopPhones.analysis.pricing;

import java.util.Map;

/** Reference resale prices (USD) by manufacturer and storage capacity. */
final class BasePriceTable {

    static final String DEFAULT_MANUFACTURER = "Samsung";
    static final double DEFAULT_PRICE = 300.0;

    private static final Map<String, Map<Integer, Double>> PRICES = Map.of(
            "Apple", Map.of(64, 300.0, 128, 400.0, 256, 500.0, 512, 650.0, 1024, 800.0),
            "Samsung", Map.of(64, 200.0, 128, 280.0, 256, 380.0, 512, 500.0, 1024, 650.0),
            "Google", Map.of(64, 180.0, 128, 250.0, 256, 350.0, 512, 450.0, 1024, 600.0));

    private BasePriceTable() {
    }

    static double lookup(String manufacturer, int storageGb) {
        Map<Integer, Double> byStorage = manufacturer == null ? null : PRICES.get(manufacturer);
        if (byStorage == null) {
            byStorage = PRICES.get(DEFAULT_MANUFACTURER);
        }
        return byStorage.getOrDefault(storageGb, DEFAULT_PRICE);
    }
}
