package com.ridehailing.fare.pricing;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ridehailing.fare.pricing.config.TrafficModifiers;

import java.util.Locale;

/**
 * Congestion level derived from observed / expected trip duration.
 */
public enum TrafficBand {

    NO_DATA,
    LIGHT,
    MODERATE,
    HEAVY,
    SEVERE;

    public static TrafficBand fromRatio(double ratio) {
        if (ratio <= 1.1) return LIGHT;
        if (ratio <= 1.3) return MODERATE;
        if (ratio <= 1.6) return HEAVY;
        return SEVERE;
    }

    public double multiplier(TrafficModifiers modifiers) {
        switch (this) {
            case LIGHT:    return modifiers.getLight();
            case MODERATE: return modifiers.getModerate();
            case HEAVY:    return modifiers.getHeavy();
            case SEVERE:   return modifiers.getSevere();
            default:       return 1.0;
        }
    }

    /** Ratio above 1.3: the estimate is likely to drift. */
    public boolean isCongested() {
        return this == HEAVY || this == SEVERE;
    }

    @JsonValue
    public String label() {
        return this == NO_DATA ? "none" : name().toLowerCase(Locale.ROOT);
    }
}
