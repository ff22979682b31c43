package com.ridehailing.fare.pricing;

import com.ridehailing.fare.exception.UnsupportedServiceException;
import com.ridehailing.fare.location.Airport;
import com.ridehailing.fare.location.AirportLocator;
import com.ridehailing.fare.pricing.config.PricingConfig;
import com.ridehailing.fare.pricing.config.ServicePricingProfile;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fare and surge pricing pipeline.
 *
 * Per request:
 *   1. Surge     — slot multiplier + airport delta, capped per service; reason from time bands.
 *   2. Location  — airport fees, CBD surcharge, long-ride fee.
 *   3. Traffic   — congestion multiplier from observed / expected duration.
 *   4. Assembly  — subtotal, surge fee and traffic fee (both on the subtotal), min-fare floor,
 *                  confidence.
 *
 * The engine holds only the immutable table and collaborators, so a single instance is
 * shared across all request threads.
 */
@Slf4j
public class FarePricingEngine {

    public static final BigDecimal KM_TO_MILES = new BigDecimal("0.621371");

    /** Cap used when surge is quoted without a service profile. */
    public static final double DEFAULT_MAX_SURGE = 3.0;

    private final PricingConfig config;
    private final AirportLocator airportLocator;
    private final Clock clock;
    private final boolean debug;

    private final SurgeClassifier surgeClassifier;
    private final LocationFeeCalculator locationFees;
    private final TrafficAdjuster trafficAdjuster;
    private final ConfidenceScorer confidenceScorer;
    private final BestTimeAdvisor bestTimeAdvisor;

    public FarePricingEngine(PricingConfig config, AirportLocator airportLocator, Clock clock, boolean debug) {
        this.config = config;
        this.airportLocator = airportLocator;
        this.clock = clock;
        this.debug = debug;
        this.surgeClassifier = new SurgeClassifier(
                config.getSurgeSchedule(), config.getLocationModifiers().getAirports());
        this.locationFees = new LocationFeeCalculator(
                config.getDowntownZones(), config.getLocationModifiers().getDowntown());
        this.trafficAdjuster = new TrafficAdjuster(config.getTrafficModifiers());
        this.confidenceScorer = new ConfidenceScorer();
        this.bestTimeAdvisor = new BestTimeAdvisor();
    }

    public PricingResult calculateFare(PricingInput input) {
        ServicePricingProfile profile = config.findService(input.getService())
                .orElseThrow(() -> new UnsupportedServiceException(input.getService()));

        ZonedDateTime time = input.getRequestTime() != null ? input.getRequestTime() : ZonedDateTime.now(clock);
        int hour = time.getHour();

        double distanceKm = finiteOrZero(input.getDistanceKm());
        double durationMin = finiteOrZero(input.getDurationMin());

        Optional<Airport> pickupAirport = airportLocator.locate(input.getPickup());
        Optional<Airport> destinationAirport = airportLocator.locate(input.getDestination());

        SurgeQuote surge = surgeClassifier.classify(pickupAirport, destinationAirport, time, profile.getMaxSurge());

        BigDecimal miles = BigDecimal.valueOf(distanceKm).multiply(KM_TO_MILES);
        BigDecimal baseFare = cents(profile.getBase());
        BigDecimal distanceFee = cents(miles.multiply(profile.getPerMile()));
        BigDecimal timeFee = cents(BigDecimal.valueOf(durationMin).multiply(profile.getPerMin()));
        BigDecimal bookingFee = cents(profile.getBooking());
        BigDecimal safetyFee = cents(profile.getSafetyFee());
        BigDecimal airportFees = cents(locationFees.airportFees(profile, pickupAirport, destinationAirport));
        BigDecimal locationSurcharge = cents(locationFees.downtownSurcharge(
                profile, input.getPickup(), input.getDestination(), hour));
        BigDecimal longRideFee = cents(locationFees.longRideFee(profile, miles));

        BigDecimal subtotal = baseFare
                .add(distanceFee)
                .add(timeFee)
                .add(bookingFee)
                .add(safetyFee)
                .add(airportFees)
                .add(locationSurcharge)
                .add(longRideFee);

        TrafficBand trafficBand = trafficAdjuster.classify(input.getObservedDurationSec(), input.getExpectedDurationSec());
        double trafficMultiplier = trafficAdjuster.multiplierFor(trafficBand);

        BigDecimal surgeFee = cents(subtotal.multiply(excess(surge.getMultiplier())));
        BigDecimal trafficFee = cents(subtotal.multiply(excess(trafficMultiplier)));

        BigDecimal minFare = cents(profile.getMinFare());
        BigDecimal finalFare = subtotal.add(surgeFee).add(trafficFee).max(minFare);
        boolean appliedMinFare = finalFare.compareTo(minFare) == 0;

        double confidence = confidenceScorer.score(distanceKm, surge.getMultiplier(), trafficBand, hour);

        PricingBreakdown breakdown = PricingBreakdown.builder()
                .baseFare(baseFare)
                .distanceFee(distanceFee)
                .timeFee(timeFee)
                .bookingFee(bookingFee)
                .safetyFee(safetyFee)
                .airportFees(airportFees)
                .locationSurcharge(locationSurcharge)
                .longRideFee(longRideFee)
                .subtotal(subtotal)
                .surgeMultiplier(surge.getMultiplier())
                .surgeFee(surgeFee)
                .trafficMultiplier(trafficMultiplier)
                .trafficFee(trafficFee)
                .finalFare(finalFare)
                .appliedMinFare(appliedMinFare)
                .confidence(confidence)
                .build();

        log.debug("Fare service={} dist={}km dur={}min subtotal={} surge={}x traffic={}x ({}) final={} minFare={} confidence={}",
                input.getService(), distanceKm, durationMin, subtotal,
                surge.getMultiplier(), trafficMultiplier, trafficBand.label(), finalFare, appliedMinFare, confidence);

        return PricingResult.builder()
                .price(finalFare)
                .breakdown(breakdown)
                .surgeReason(surge.getSurgeReason())
                .debugInfo(debug ? debugInfo(input, time, miles, pickupAirport, destinationAirport, trafficBand) : null)
                .build();
    }

    public SurgeQuote calculateSurge(Coordinates pickup, Coordinates destination) {
        return calculateSurge(pickup, destination, null);
    }

    public SurgeQuote calculateSurge(Coordinates pickup, Coordinates destination, ZonedDateTime time) {
        return surgeClassifier.classify(
                airportLocator.locate(pickup),
                airportLocator.locate(destination),
                time != null ? time : ZonedDateTime.now(clock),
                DEFAULT_MAX_SURGE);
    }

    public List<String> getBestTimeRecommendations() {
        return getBestTimeRecommendations(null);
    }

    public List<String> getBestTimeRecommendations(ZonedDateTime time) {
        return bestTimeAdvisor.recommendationsFor(time != null ? time : ZonedDateTime.now(clock));
    }

    public boolean hasAirportSurcharge(Coordinates pickup, Coordinates destination) {
        return airportLocator.locate(pickup).isPresent() || airportLocator.locate(destination).isPresent();
    }

    public ServicePricingProfile profileFor(String service) {
        return config.findService(service)
                .orElseThrow(() -> new UnsupportedServiceException(service));
    }

    public Set<String> supportedServices() {
        return config.serviceIds();
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    private Map<String, Object> debugInfo(PricingInput input,
                                          ZonedDateTime time,
                                          BigDecimal miles,
                                          Optional<Airport> pickupAirport,
                                          Optional<Airport> destinationAirport,
                                          TrafficBand trafficBand) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("configVersion", config.getVersion());
        info.put("distanceMiles", miles.setScale(2, RoundingMode.HALF_UP));
        info.put("pickupAirport", pickupAirport.map(Airport::getCode).orElse(null));
        info.put("destinationAirport", destinationAirport.map(Airport::getCode).orElse(null));
        info.put("downtown", locationFees.isDowntown(input.getPickup()) || locationFees.isDowntown(input.getDestination()));
        info.put("timeSlot", TimeBands.slotKey(time));
        info.put("weekend", TimeBands.isWeekend(time));
        info.put("trafficBand", trafficBand.label());
        return Collections.unmodifiableMap(info);
    }

    /** NaN and infinite trip values price as an empty trip. */
    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private static BigDecimal excess(double multiplier) {
        return BigDecimal.valueOf(multiplier).subtract(BigDecimal.ONE);
    }

    private static BigDecimal cents(BigDecimal amount) {
        return (amount != null ? amount : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }
}
