package com.ridehailing.fare.pricing;

import java.math.BigDecimal;

/**
 * Heuristic certainty of an estimate, 0.5 to 0.9. Penalties are independent and summed
 * before the floor is applied.
 */
public class ConfidenceScorer {

    static final BigDecimal MAX_CONFIDENCE = new BigDecimal("0.90");
    static final BigDecimal MIN_CONFIDENCE = new BigDecimal("0.50");

    private static final BigDecimal VERY_LONG_TRIP_PENALTY = new BigDecimal("0.15");
    private static final BigDecimal LONG_TRIP_PENALTY = new BigDecimal("0.10");
    private static final BigDecimal HIGH_SURGE_PENALTY = new BigDecimal("0.10");
    private static final BigDecimal CONGESTION_PENALTY = new BigDecimal("0.10");
    private static final BigDecimal SMALL_HOURS_PENALTY = new BigDecimal("0.10");

    public double score(double distanceKm, double surgeMultiplier, TrafficBand trafficBand, int hour) {
        BigDecimal confidence = MAX_CONFIDENCE;

        if (distanceKm > 50) {
            confidence = confidence.subtract(VERY_LONG_TRIP_PENALTY);
        } else if (distanceKm > 25) {
            confidence = confidence.subtract(LONG_TRIP_PENALTY);
        }
        if (surgeMultiplier > 2.0) {
            confidence = confidence.subtract(HIGH_SURGE_PENALTY);
        }
        if (trafficBand.isCongested()) {
            confidence = confidence.subtract(CONGESTION_PENALTY);
        }
        if (hour >= 1 && hour <= 5) {
            confidence = confidence.subtract(SMALL_HOURS_PENALTY);
        }

        return confidence.max(MIN_CONFIDENCE).doubleValue();
    }
}
