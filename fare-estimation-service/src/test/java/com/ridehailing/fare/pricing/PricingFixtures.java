package com.ridehailing.fare.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridehailing.fare.config.PricingConfigLoader;
import com.ridehailing.fare.location.Airport;
import com.ridehailing.fare.pricing.config.PricingConfig;
import org.springframework.core.io.ClassPathResource;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Shared coordinates, timestamps and the production pricing table for pricing tests.
 */
public final class PricingFixtures {

    public static final ZoneId ZONE = ZoneId.of("America/Los_Angeles");

    // Neither airport nor downtown
    public static final Coordinates REGULAR = Coordinates.of(37.75, -122.45);
    public static final Coordinates REGULAR_DEST = Coordinates.of(37.78, -122.48);

    public static final Coordinates DOWNTOWN_SF = Coordinates.of(37.79, -122.405);
    public static final Coordinates DOWNTOWN_SJ = Coordinates.of(37.335, -121.885);

    public static final Coordinates SFO = Coordinates.of(37.6213, -122.379);
    public static final Coordinates OAK = Coordinates.of(37.7126, -122.2197);
    public static final Coordinates SJC = Coordinates.of(37.3639, -121.9289);

    public static final Airport SFO_AIRPORT = airport("SFO", "San Francisco International Airport", SFO);
    public static final Airport OAK_AIRPORT = airport("OAK", "Oakland International Airport", OAK);
    public static final Airport SJC_AIRPORT = airport("SJC", "San Jose International Airport", SJC);

    private PricingFixtures() {}

    public static PricingConfig productionConfig() {
        return new PricingConfigLoader(new ObjectMapper()).load(new ClassPathResource("pricing-config.json"));
    }

    /** 2024-01-15 is a Monday, 2024-01-20 a Saturday, 2024-01-21 a Sunday. */
    public static ZonedDateTime at(int dayOfMonth, int hour, int minute) {
        return ZonedDateTime.of(2024, 1, dayOfMonth, hour, minute, 0, 0, ZONE);
    }

    public static ZonedDateTime monday(int hour, int minute) {
        return at(15, hour, minute);
    }

    public static ZonedDateTime saturday(int hour, int minute) {
        return at(20, hour, minute);
    }

    private static Airport airport(String code, String name, Coordinates location) {
        return Airport.builder().code(code).name(name).location(location).build();
    }
}
