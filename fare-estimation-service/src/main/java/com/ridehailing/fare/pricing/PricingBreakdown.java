package com.ridehailing.fare.pricing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Itemized fare. Every amount is rounded half-up to cents; {@code subtotal} is the sum
 * of the eight fee lines and both surge and traffic fees are computed against it.
 */
@Value
@Builder
public class PricingBreakdown {

    BigDecimal baseFare;
    BigDecimal distanceFee;
    BigDecimal timeFee;
    BigDecimal bookingFee;
    BigDecimal safetyFee;
    BigDecimal airportFees;
    BigDecimal locationSurcharge;
    BigDecimal longRideFee;
    BigDecimal subtotal;

    double surgeMultiplier;
    BigDecimal surgeFee;

    double trafficMultiplier;
    BigDecimal trafficFee;

    BigDecimal finalFare;
    boolean appliedMinFare;
    double confidence;
}
