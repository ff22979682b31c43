package com.ridehailing.fare.pricing.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Flat fee charged once the trip reaches {@code thresholdMiles}.
 */
@Value
@Builder
@Jacksonized
public class LongRideFee {
    BigDecimal thresholdMiles;
    BigDecimal fee;
}
