package com.ridehailing.fare.pricing;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PricingResult {

    BigDecimal price;
    PricingBreakdown breakdown;
    String surgeReason;

    /** Only populated when the engine runs in debug mode. */
    Map<String, Object> debugInfo;
}
