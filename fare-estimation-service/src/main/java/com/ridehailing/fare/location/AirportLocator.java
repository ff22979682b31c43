package com.ridehailing.fare.location;

import com.ridehailing.fare.pricing.Coordinates;

import java.util.Optional;

/**
 * Resolves a coordinate to the airport whose geofence contains it.
 *
 * Implementations must be pure functions of the coordinate: no I/O and no mutable
 * state, so that fare estimates stay deterministic.
 */
public interface AirportLocator {

    Optional<Airport> locate(Coordinates point);
}
