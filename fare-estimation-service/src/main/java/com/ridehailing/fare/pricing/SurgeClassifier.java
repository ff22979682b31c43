package com.ridehailing.fare.pricing;

import com.ridehailing.fare.location.Airport;
import com.ridehailing.fare.pricing.config.LocationModifiers;
import com.ridehailing.fare.pricing.config.SurgeSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Surge multiplier and reason for a request.
 *
 * Two independent rules run here:
 *   1. Multiplier base — exact half-hour slot lookup in the weekday/weekend schedule (1.0 if absent).
 *   2. Reason — broad bands (late night, rush hour) combined with airport adjacency.
 * An airport route at late night or rush hour adds {@code modifier - 1} to the base; the sum
 * is then capped at the caller's limit.
 */
@Slf4j
@RequiredArgsConstructor
public class SurgeClassifier {

    private final SurgeSchedule schedule;
    private final LocationModifiers.Airports airportModifiers;

    public SurgeQuote classify(Optional<Airport> pickupAirport,
                               Optional<Airport> destinationAirport,
                               ZonedDateTime time,
                               double maxSurge) {
        boolean weekend = TimeBands.isWeekend(time);
        int hour = time.getHour();
        String slot = TimeBands.slotKey(time);
        double baseSurge = schedule.multiplierFor(weekend, slot);

        boolean airportRoute = pickupAirport.isPresent() || destinationAirport.isPresent();
        boolean lateNight = TimeBands.isLateNight(hour);
        boolean peakCommute = TimeBands.isPeakCommute(hour, weekend);

        SurgeReason reason;
        double modifier = 1.0;
        if (airportRoute && lateNight) {
            reason = SurgeReason.LATE_NIGHT_AIRPORT;
            modifier = airportModifiers.getLateNight();
        } else if (airportRoute && peakCommute) {
            reason = SurgeReason.PEAK_HOURS_AIRPORT;
            modifier = airportModifiers.getPeakHours();
        } else if (airportRoute) {
            reason = SurgeReason.AIRPORT_ROUTE;
        } else if (lateNight) {
            reason = SurgeReason.LATE_NIGHT;
        } else if (peakCommute) {
            reason = SurgeReason.RUSH_HOUR;
        } else {
            reason = SurgeReason.STANDARD;
        }

        BigDecimal delta = BigDecimal.valueOf(modifier).subtract(BigDecimal.ONE);
        double multiplier = BigDecimal.valueOf(baseSurge)
                .add(delta)
                .min(BigDecimal.valueOf(maxSurge))
                .doubleValue();

        log.debug("Surge slot={} weekend={} base={} delta={} cap={} -> {} ({})",
                slot, weekend, baseSurge, delta, maxSurge, multiplier, reason.getLabel());
        return SurgeQuote.of(multiplier, reason);
    }
}
