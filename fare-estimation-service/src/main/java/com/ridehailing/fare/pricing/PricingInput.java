package com.ridehailing.fare.pricing;

import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

/**
 * One fare request. {@code requestTime} falls back to the engine clock when null;
 * both traffic durations must be present (and positive) for a congestion adjustment.
 */
@Value
@Builder
public class PricingInput {

    String service;
    Coordinates pickup;
    Coordinates destination;
    double distanceKm;
    double durationMin;
    ZonedDateTime requestTime;
    Double observedDurationSec;
    Double expectedDurationSec;
}
