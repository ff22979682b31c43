package com.ridehailing.fare.location;

import com.ridehailing.fare.pricing.Coordinates;

import java.util.List;

/**
 * Major US airports served by the comparison surface.
 */
public final class AirportCatalog {

    public static final List<Airport> DEFAULT_AIRPORTS = List.of(
            airport("SFO", "San Francisco International Airport", "San Francisco", 37.6213, -122.3790),
            airport("SJC", "San Jose International Airport", "San Jose", 37.3639, -121.9289),
            airport("OAK", "Oakland International Airport", "Oakland", 37.7126, -122.2197),
            airport("LAX", "Los Angeles International Airport", "Los Angeles", 33.9425, -118.4085),
            airport("JFK", "John F. Kennedy International Airport", "New York", 40.6413, -73.7781),
            airport("EWR", "Newark Liberty International Airport", "Newark", 40.6895, -74.1745),
            airport("ORD", "O'Hare International Airport", "Chicago", 41.9742, -87.9073),
            airport("ATL", "Hartsfield-Jackson Atlanta International Airport", "Atlanta", 33.6407, -84.4277),
            airport("SEA", "Seattle-Tacoma International Airport", "Seattle", 47.4502, -122.3088),
            airport("DEN", "Denver International Airport", "Denver", 39.8561, -104.6737),
            airport("BOS", "Logan International Airport", "Boston", 42.3656, -71.0096),
            airport("DFW", "Dallas/Fort Worth International Airport", "Dallas", 32.8968, -97.0372)
    );

    private AirportCatalog() {}

    private static Airport airport(String code, String name, String city, double lat, double lng) {
        return Airport.builder()
                .code(code)
                .name(name)
                .city(city)
                .location(Coordinates.of(lat, lng))
                .build();
    }
}
