package com.ridehailing.fare.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridehailing.fare.location.AirportLocator;
import com.ridehailing.fare.location.StaticAirportLocator;
import com.ridehailing.fare.pricing.FarePricingEngine;
import com.ridehailing.fare.pricing.config.PricingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
@RequiredArgsConstructor
public class PricingConfiguration {

    private final PricingProperties properties;

    @Bean
    public Clock pricingClock() {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }

    @Bean
    public PricingConfig pricingConfig(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new PricingConfigLoader(objectMapper)
                .load(resourceLoader.getResource(properties.getConfigLocation()));
    }

    @Bean
    public AirportLocator airportLocator() {
        return StaticAirportLocator.withDefaultCatalog(properties.getAirportToleranceDegrees());
    }

    @Bean
    public FarePricingEngine farePricingEngine(PricingConfig pricingConfig,
                                               AirportLocator airportLocator,
                                               Clock pricingClock) {
        if (properties.isDebug()) {
            log.info("Pricing debug payload enabled");
        }
        return new FarePricingEngine(pricingConfig, airportLocator, pricingClock, properties.isDebug());
    }
}
