package com.ridehailing.fare.pricing.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TrafficModifiers {
    double light;
    double moderate;
    double heavy;
    double severe;
}
