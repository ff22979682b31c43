package com.ridehailing.fare.pricing.config;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The static pricing table: one profile per service, the surge schedule and the
 * location/traffic modifiers. Loaded once at start-up and never mutated.
 */
@Value
@Builder
@Jacksonized
public class PricingConfig {

    String version;

    @Getter(AccessLevel.NONE)
    @Singular
    Map<String, ServicePricingProfile> services;

    SurgeSchedule surgeSchedule;
    LocationModifiers locationModifiers;
    TrafficModifiers trafficModifiers;

    @Singular
    List<DowntownZone> downtownZones;

    /**
     * Service ids are matched case-insensitively.
     */
    public Optional<ServicePricingProfile> findService(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(services.get(serviceId.toLowerCase(Locale.ROOT)));
    }

    public Set<String> serviceIds() {
        return services.keySet();
    }
}
