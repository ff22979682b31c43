package com.ridehailing.fare.location;

import com.ridehailing.fare.pricing.Coordinates;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Airport {
    String code;
    String name;
    String city;
    Coordinates location;
}
