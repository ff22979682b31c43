package com.ridehailing.fare.location;

import com.ridehailing.fare.pricing.Coordinates;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Tolerance-box geofence over a fixed airport table. A point matches an airport when both
 * its latitude and longitude are strictly within {@code toleranceDegrees} of the airport's
 * reference point; the first match in table order wins.
 */
@Slf4j
public class StaticAirportLocator implements AirportLocator {

    public static final double DEFAULT_TOLERANCE_DEGREES = 0.05;

    private final List<Airport> airports;
    private final double toleranceDegrees;

    public StaticAirportLocator(List<Airport> airports, double toleranceDegrees) {
        this.airports = List.copyOf(airports);
        this.toleranceDegrees = toleranceDegrees;
    }

    public static StaticAirportLocator withDefaultCatalog(double toleranceDegrees) {
        return new StaticAirportLocator(AirportCatalog.DEFAULT_AIRPORTS, toleranceDegrees);
    }

    @Override
    public Optional<Airport> locate(Coordinates point) {
        if (point == null) {
            return Optional.empty();
        }
        for (Airport airport : airports) {
            Coordinates ref = airport.getLocation();
            if (Math.abs(point.getLat() - ref.getLat()) < toleranceDegrees
                    && Math.abs(point.getLng() - ref.getLng()) < toleranceDegrees) {
                log.trace("Point {} resolved to airport {}", point, airport.getCode());
                return Optional.of(airport);
            }
        }
        return Optional.empty();
    }

    public List<Airport> getAirports() {
        return airports;
    }
}
