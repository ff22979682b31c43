package com.ridehailing.fare.pricing.config;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Half-hour slot multipliers, keyed "HH:MM-HH:MM" (e.g. "08:00-08:30").
 *
 * Lookup is by exact key only. A slot without an entry prices at 1.0, even when the
 * broad time band (late night, rush hour) says demand is elevated.
 */
@Value
@Builder
@Jacksonized
public class SurgeSchedule {

    public static final double DEFAULT_MULTIPLIER = 1.0;

    @Getter(AccessLevel.NONE)
    @Singular("weekdaySlot")
    Map<String, Double> weekday;

    @Getter(AccessLevel.NONE)
    @Singular("weekendSlot")
    Map<String, Double> weekend;

    public double multiplierFor(boolean isWeekend, String slotKey) {
        Map<String, Double> table = isWeekend ? weekend : weekday;
        return table.getOrDefault(slotKey, DEFAULT_MULTIPLIER);
    }

    public boolean hasSlot(boolean isWeekend, String slotKey) {
        return (isWeekend ? weekend : weekday).containsKey(slotKey);
    }
}
