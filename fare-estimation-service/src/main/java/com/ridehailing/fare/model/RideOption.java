package com.ridehailing.fare.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ridehailing.fare.pricing.PricingBreakdown;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

/**
 * One column of the side-by-side comparison.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RideOption {
    private String service;
    private String label;
    private BigDecimal fare;
    private String price;
    private String surgeLabel;
    private String surgeReason;
    private int waitMinutes;
    private String trafficLevel;
    private PricingBreakdown breakdown;
}
