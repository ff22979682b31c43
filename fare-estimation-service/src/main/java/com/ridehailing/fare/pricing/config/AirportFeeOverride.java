package com.ridehailing.fare.pricing.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class AirportFeeOverride {
    BigDecimal pickup;
    BigDecimal dropoff;
}
