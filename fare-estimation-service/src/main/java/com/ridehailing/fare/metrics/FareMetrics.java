package com.ridehailing.fare.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Custom Micrometer metrics for the Fare Estimation Service.
 *
 * Metrics at /actuator/prometheus:
 *   fare_estimates_total{service}        — fares priced, per service
 *   fare_min_fare_applied_total          — estimates raised to the service floor
 *   fare_unsupported_service_total       — requests rejected for an unknown service id
 *   fare_surge_multiplier_last           — surge multiplier of the most recent estimate
 */
@Component
public class FareMetrics {

    private final MeterRegistry registry;
    private final Counter minFareApplied;
    private final Counter unsupportedService;
    private final AtomicReference<Double> lastSurgeMultiplier = new AtomicReference<>(1.0);

    public FareMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.minFareApplied = Counter.builder("fare.min_fare_applied")
                .description("Estimates raised to the service minimum fare")
                .register(registry);

        this.unsupportedService = Counter.builder("fare.unsupported_service")
                .description("Requests rejected because the service id has no pricing profile")
                .register(registry);

        Gauge.builder("fare.surge.multiplier.last", lastSurgeMultiplier, AtomicReference::get)
                .description("Surge multiplier applied to the most recent estimate")
                .register(registry);
    }

    public void recordEstimate(String service, boolean appliedMinFare, double surgeMultiplier) {
        Counter.builder("fare.estimates")
                .description("Fares priced by the engine")
                .tag("service", service)
                .register(registry)
                .increment();
        if (appliedMinFare) {
            minFareApplied.increment();
        }
        lastSurgeMultiplier.set(surgeMultiplier);
    }

    public void recordUnsupportedService() { unsupportedService.increment(); }
}
