package com.ridehailing.fare.service;

import com.ridehailing.fare.config.PricingProperties;
import com.ridehailing.fare.exception.UnsupportedServiceException;
import com.ridehailing.fare.metrics.FareMetrics;
import com.ridehailing.fare.model.FareComparison;
import com.ridehailing.fare.model.FareComparisonRequest;
import com.ridehailing.fare.model.FareEstimateRequest;
import com.ridehailing.fare.model.RideOption;
import com.ridehailing.fare.model.SurgeInfo;
import com.ridehailing.fare.pricing.Coordinates;
import com.ridehailing.fare.pricing.FarePricingEngine;
import com.ridehailing.fare.pricing.PricingInput;
import com.ridehailing.fare.pricing.PricingResult;
import com.ridehailing.fare.pricing.SurgeQuote;
import com.ridehailing.fare.pricing.TrafficBand;
import com.ridehailing.fare.pricing.config.ServicePricingProfile;
import com.ridehailing.shared.util.H3Util;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Host-side wrapper around {@link FarePricingEngine}: maps REST requests onto engine inputs,
 * prices every service for the comparison surface and records metrics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FareEstimationService {

    static final int MIN_WAIT_MINUTES = 2;
    static final int MAX_WAIT_MINUTES = 18;

    private final FarePricingEngine engine;
    private final FareMetrics fareMetrics;
    private final PricingProperties properties;

    public PricingResult estimate(FareEstimateRequest request) {
        PricingInput input = PricingInput.builder()
                .service(request.getService())
                .pickup(Coordinates.of(request.getPickupLat(), request.getPickupLng()))
                .destination(Coordinates.of(request.getDestinationLat(), request.getDestinationLng()))
                .distanceKm(request.getDistanceKm())
                .durationMin(request.getDurationMin())
                .requestTime(toZoned(request.getRequestedAt()))
                .observedDurationSec(request.getObservedDurationSec())
                .expectedDurationSec(request.getExpectedDurationSec())
                .build();
        return price(input);
    }

    /**
     * Prices every requested service with identical trip inputs and a single request time,
     * so the columns are directly comparable.
     */
    public FareComparison compare(FareComparisonRequest request) {
        Coordinates pickup = Coordinates.of(request.getPickupLat(), request.getPickupLng());
        Coordinates destination = Coordinates.of(request.getDestinationLat(), request.getDestinationLng());
        ZonedDateTime time = request.getRequestedAt() != null
                ? request.getRequestedAt().toZonedDateTime()
                : engine.now();

        double distanceKm = request.getDistanceKm() != null
                ? request.getDistanceKm()
                : H3Util.distanceKm(pickup.getLat(), pickup.getLng(), destination.getLat(), destination.getLng());

        Double expectedDurationSec = request.getExpectedDurationSec();
        if (request.getObservedDurationSec() != null && expectedDurationSec == null) {
            expectedDurationSec = request.getDurationMin() * 60;
        }

        // every id is checked before any service is priced
        Map<String, ServicePricingProfile> profiles = new LinkedHashMap<>();
        for (String service : resolveServices(request.getServices())) {
            profiles.put(service, profileFor(service));
        }

        List<RideOption> options = new ArrayList<>();
        for (Map.Entry<String, ServicePricingProfile> entry : profiles.entrySet()) {
            String service = entry.getKey();
            PricingResult result = price(PricingInput.builder()
                    .service(service)
                    .pickup(pickup)
                    .destination(destination)
                    .distanceKm(distanceKm)
                    .durationMin(request.getDurationMin())
                    .requestTime(time)
                    .observedDurationSec(request.getObservedDurationSec())
                    .expectedDurationSec(expectedDurationSec)
                    .build());
            options.add(toRideOption(service, entry.getValue(), result, request.getDurationMin()));
        }

        String cheapest = options.stream()
                .min(Comparator.comparing(RideOption::getFare))
                .map(RideOption::getService)
                .orElse(null);

        log.info("Compared {} services dist={}km dur={}min at={} cheapest={}",
                options.size(), distanceKm, request.getDurationMin(), time, cheapest);

        return FareComparison.builder()
                .options(options)
                .cheapestService(cheapest)
                .surge(toSurgeInfo(engine.calculateSurge(pickup, destination, time)))
                .timeRecommendations(engine.getBestTimeRecommendations(time))
                .distanceKm(distanceKm)
                .requestedAt(time)
                .pickupCell(H3Util.snapshotCell(pickup.getLat(), pickup.getLng()))
                .build();
    }

    public SurgeInfo surge(Coordinates pickup, Coordinates destination, OffsetDateTime at) {
        return toSurgeInfo(engine.calculateSurge(pickup, destination, toZoned(at)));
    }

    public List<String> recommendations(OffsetDateTime at) {
        return engine.getBestTimeRecommendations(toZoned(at));
    }

    public boolean hasAirportSurcharge(Coordinates pickup, Coordinates destination) {
        return engine.hasAirportSurcharge(pickup, destination);
    }

    /**
     * Base wait of the service, plus up to 3 minutes for demand and up to 4 for trip length,
     * clamped to [2, 18].
     */
    static int deriveWaitMinutes(int baseWaitMinutes, double surgeMultiplier, double durationMin) {
        int demandPenalty = surgeMultiplier > 1.4 ? 3 : surgeMultiplier > 1.2 ? 2 : surgeMultiplier > 1.05 ? 1 : 0;
        int tripComplexity = (int) Math.min(4, Math.round(durationMin / 15));
        return Math.max(MIN_WAIT_MINUTES, Math.min(MAX_WAIT_MINUTES, baseWaitMinutes + demandPenalty + tripComplexity));
    }

    static String formatPrice(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private PricingResult price(PricingInput input) {
        try {
            PricingResult result = engine.calculateFare(input);
            fareMetrics.recordEstimate(input.getService().toLowerCase(Locale.ROOT),
                    result.getBreakdown().isAppliedMinFare(),
                    result.getBreakdown().getSurgeMultiplier());
            return result;
        } catch (UnsupportedServiceException e) {
            fareMetrics.recordUnsupportedService();
            throw e;
        }
    }

    private ServicePricingProfile profileFor(String service) {
        try {
            return engine.profileFor(service);
        } catch (UnsupportedServiceException e) {
            fareMetrics.recordUnsupportedService();
            throw e;
        }
    }

    private Set<String> resolveServices(List<String> requested) {
        Set<String> services = new LinkedHashSet<>();
        if (requested == null || requested.isEmpty()) {
            services.addAll(engine.supportedServices());
            return services;
        }
        for (String service : requested) {
            if (service != null && !service.isBlank()) {
                services.add(service.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (services.isEmpty()) {
            services.addAll(engine.supportedServices());
        }
        return services;
    }

    private RideOption toRideOption(String service, ServicePricingProfile profile, PricingResult result, double durationMin) {
        double surge = result.getBreakdown().getSurgeMultiplier();
        return RideOption.builder()
                .service(service)
                .label(profile.getLabel() != null ? profile.getLabel() : service)
                .fare(result.getPrice())
                .price(formatPrice(result.getPrice()))
                .surgeLabel(surge > properties.getSurgeActiveThreshold() ? String.format(Locale.ROOT, "%.2fx", surge) : null)
                .surgeReason(result.getSurgeReason())
                .waitMinutes(deriveWaitMinutes(profile.getBaseWaitMinutes(), surge, durationMin))
                .trafficLevel(trafficLevel(result.getBreakdown().getTrafficMultiplier()))
                .breakdown(result.getBreakdown())
                .build();
    }

    private SurgeInfo toSurgeInfo(SurgeQuote quote) {
        return SurgeInfo.builder()
                .multiplier(quote.getMultiplier())
                .reason(quote.getSurgeReason())
                .active(quote.getMultiplier() > properties.getSurgeActiveThreshold())
                .build();
    }

    private static String trafficLevel(double trafficMultiplier) {
        if (trafficMultiplier <= 1.0) return TrafficBand.LIGHT.label();
        if (trafficMultiplier <= 1.1) return TrafficBand.MODERATE.label();
        if (trafficMultiplier <= 1.25) return TrafficBand.HEAVY.label();
        return TrafficBand.SEVERE.label();
    }

    private static ZonedDateTime toZoned(OffsetDateTime time) {
        return time != null ? time.toZonedDateTime() : null;
    }
}
