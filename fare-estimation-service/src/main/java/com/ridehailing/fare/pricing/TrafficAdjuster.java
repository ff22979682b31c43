package com.ridehailing.fare.pricing;

import com.ridehailing.fare.pricing.config.TrafficModifiers;
import lombok.RequiredArgsConstructor;

/**
 * Maps observed vs. free-flow duration onto a congestion multiplier.
 */
@RequiredArgsConstructor
public class TrafficAdjuster {

    private final TrafficModifiers modifiers;

    public TrafficBand classify(Double observedDurationSec, Double expectedDurationSec) {
        if (!isPositive(observedDurationSec) || !isPositive(expectedDurationSec)) {
            return TrafficBand.NO_DATA;
        }
        return TrafficBand.fromRatio(observedDurationSec / expectedDurationSec);
    }

    public double multiplierFor(TrafficBand band) {
        return band.multiplier(modifiers);
    }

    private static boolean isPositive(Double seconds) {
        return seconds != null && Double.isFinite(seconds) && seconds > 0;
    }
}
