package com.ridehailing.fare.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
public class FareComparisonRequest {

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double destinationLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double destinationLng;

    /** Routed distance; the great-circle distance is used when absent. */
    @DecimalMin("0.0") @DecimalMax("2000.0")
    private Double distanceKm;

    @NotNull
    @DecimalMin("0.0") @DecimalMax("1440.0")
    private Double durationMin;

    private OffsetDateTime requestedAt;

    private Double observedDurationSec;

    /** Free-flow duration; defaults to durationMin * 60 when only the observed duration is sent. */
    private Double expectedDurationSec;

    /** Service ids to price; every configured service when empty. */
    private List<String> services;
}
