package com.ridehailing.fare.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class FareEstimateRequest {

    @NotBlank
    private String service;

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

    @NotNull
    @DecimalMin("0.0") @DecimalMax("2000.0")
    private Double distanceKm;

    @NotNull
    @DecimalMin("0.0") @DecimalMax("1440.0")
    private Double durationMin;

    /** Defaults to now when absent. */
    private OffsetDateTime requestedAt;

    private Double observedDurationSec;

    private Double expectedDurationSec;
}
