package com.ridehailing.fare.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridehailing.fare.pricing.config.PricingConfig;
import com.ridehailing.fare.pricing.config.ServicePricingProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the pricing table from a JSON resource. Any read or shape problem fails fast:
 * the service must not start with a partial rate card.
 */
@Slf4j
@RequiredArgsConstructor
public class PricingConfigLoader {

    private final ObjectMapper objectMapper;

    public PricingConfig load(Resource resource) {
        PricingConfig config;
        try (InputStream in = resource.getInputStream()) {
            config = objectMapper.readValue(in, PricingConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load pricing table from " + resource.getDescription(), e);
        }
        validate(config, resource);
        log.info("Loaded pricing table version={} services={} from {}",
                config.getVersion(), config.serviceIds(), resource.getDescription());
        return config;
    }

    private void validate(PricingConfig config, Resource resource) {
        if (config.serviceIds().isEmpty()) {
            throw new IllegalStateException("Pricing table " + resource.getDescription() + " defines no services");
        }
        if (config.getSurgeSchedule() == null || config.getLocationModifiers() == null
                || config.getLocationModifiers().getAirports() == null
                || config.getLocationModifiers().getDowntown() == null
                || config.getTrafficModifiers() == null) {
            throw new IllegalStateException("Pricing table " + resource.getDescription()
                    + " is missing surgeSchedule, locationModifiers or trafficModifiers");
        }
        for (String id : config.serviceIds()) {
            ServicePricingProfile profile = config.findService(id).orElseThrow();
            if (profile.getBase() == null || profile.getPerMile() == null
                    || profile.getPerMin() == null || profile.getMinFare() == null) {
                throw new IllegalStateException("Service '" + id + "' lacks base, perMile, perMin or minFare");
            }
            if (profile.getMaxSurge() < 1.0) {
                throw new IllegalStateException("Service '" + id + "' has maxSurge below 1.0: " + profile.getMaxSurge());
            }
        }
    }
}
