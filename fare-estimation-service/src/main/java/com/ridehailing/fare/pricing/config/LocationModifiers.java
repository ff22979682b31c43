package com.ridehailing.fare.pricing.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Airport modifiers feed the surge multiplier additively ({@code modifier - 1});
 * downtown factors scale the CBD surcharge.
 */
@Value
@Builder
@Jacksonized
public class LocationModifiers {

    Airports airports;
    Downtown downtown;

    @Value
    @Builder
    @Jacksonized
    public static class Airports {
        double lateNight;
        double peakHours;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Downtown {
        double businessHours;
        double nightlife;
    }
}
