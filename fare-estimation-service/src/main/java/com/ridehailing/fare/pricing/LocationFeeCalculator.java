package com.ridehailing.fare.pricing;

import com.ridehailing.fare.location.Airport;
import com.ridehailing.fare.pricing.config.DowntownZone;
import com.ridehailing.fare.pricing.config.LocationModifiers;
import com.ridehailing.fare.pricing.config.LongRideFee;
import com.ridehailing.fare.pricing.config.ServicePricingProfile;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Geography-driven fee lines: airport pickup/dropoff fees, the downtown (CBD) surcharge
 * and the long-ride fee. Returned amounts are unrounded.
 */
@RequiredArgsConstructor
public class LocationFeeCalculator {

    private final List<DowntownZone> downtownZones;
    private final LocationModifiers.Downtown downtownModifiers;

    /**
     * Pickup and dropoff sides are charged independently, so an airport-to-airport
     * trip pays both.
     */
    public BigDecimal airportFees(ServicePricingProfile profile,
                                  Optional<Airport> pickupAirport,
                                  Optional<Airport> destinationAirport) {
        BigDecimal total = BigDecimal.ZERO;
        if (pickupAirport.isPresent()) {
            total = total.add(orZero(profile.pickupFeeFor(pickupAirport.get().getCode())));
        }
        if (destinationAirport.isPresent()) {
            total = total.add(orZero(profile.dropoffFeeFor(destinationAirport.get().getCode())));
        }
        return total;
    }

    /**
     * At most one surcharge per trip. Business hours (9-17) halve it, nightlife (20-2)
     * raises it; other hours charge the base amount.
     */
    public BigDecimal downtownSurcharge(ServicePricingProfile profile,
                                       Coordinates pickup,
                                       Coordinates destination,
                                       int hour) {
        BigDecimal base = profile.getCbdSurcharge();
        if (base == null || base.signum() == 0) {
            return BigDecimal.ZERO;
        }
        if (!isDowntown(pickup) && !isDowntown(destination)) {
            return BigDecimal.ZERO;
        }
        if (TimeBands.isBusinessHours(hour)) {
            return base.multiply(BigDecimal.valueOf(downtownModifiers.getBusinessHours()));
        }
        if (TimeBands.isNightlife(hour)) {
            return base.multiply(BigDecimal.valueOf(downtownModifiers.getNightlife()));
        }
        return base;
    }

    public BigDecimal longRideFee(ServicePricingProfile profile, BigDecimal distanceMiles) {
        LongRideFee longRide = profile.getLongRideFee();
        if (longRide != null && distanceMiles.compareTo(longRide.getThresholdMiles()) >= 0) {
            return longRide.getFee();
        }
        return BigDecimal.ZERO;
    }

    public boolean isDowntown(Coordinates point) {
        if (point == null) {
            return false;
        }
        for (DowntownZone zone : downtownZones) {
            if (zone.contains(point)) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
