package com.ridehailing.fare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code pricing.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    /** Spring resource location of the JSON pricing table. */
    private String configLocation = "classpath:pricing-config.json";

    /** Zone of the clock used when a request carries no timestamp. */
    private String zoneId = "America/Los_Angeles";

    /** Attach the debug payload to every pricing result. */
    private boolean debug = false;

    private double airportToleranceDegrees = 0.05;

    /** Surge above this multiplier is reported as active to the comparison surface. */
    private double surgeActiveThreshold = 1.05;
}
