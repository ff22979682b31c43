package com.ridehailing.fare.pricing;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human-readable demand explanation, listed in classification priority order.
 */
public enum SurgeReason {

    LATE_NIGHT_AIRPORT("Late night airport premium"),
    PEAK_HOURS_AIRPORT("Peak hours airport demand"),
    AIRPORT_ROUTE("Airport route"),
    LATE_NIGHT("Late night premium"),
    RUSH_HOUR("Rush hour demand"),
    STANDARD("Standard pricing");

    private final String label;

    SurgeReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
