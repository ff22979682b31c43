package com.ridehailing.fare.pricing.config;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Rate card of a single mobility service. Amounts are in the service's base currency unit.
 */
@Value
@Builder
@Jacksonized
public class ServicePricingProfile {

    String label;

    BigDecimal base;
    BigDecimal perMile;
    BigDecimal perMin;
    BigDecimal booking;
    BigDecimal safetyFee;
    BigDecimal minFare;

    BigDecimal airportPickupFee;
    BigDecimal airportDropoffFee;

    /** Keyed by upper-case IATA code; consulted before the generic airport fees. */
    @Getter(AccessLevel.NONE)
    @Singular
    Map<String, AirportFeeOverride> airportFeeOverrides;

    BigDecimal cbdSurcharge;
    LongRideFee longRideFee;
    double maxSurge;
    int baseWaitMinutes;

    public BigDecimal pickupFeeFor(String airportCode) {
        AirportFeeOverride override = airportFeeOverrides.get(airportCode);
        return override != null ? override.getPickup() : airportPickupFee;
    }

    public BigDecimal dropoffFeeFor(String airportCode) {
        AirportFeeOverride override = airportFeeOverrides.get(airportCode);
        return override != null ? override.getDropoff() : airportDropoffFee;
    }

    public boolean hasAirportFeeOverride(String airportCode) {
        return airportFeeOverrides.containsKey(airportCode);
    }
}
