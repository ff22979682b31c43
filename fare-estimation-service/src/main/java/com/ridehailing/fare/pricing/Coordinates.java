package com.ridehailing.fare.pricing;

import lombok.Value;

@Value(staticConstructor = "of")
public class Coordinates {
    double lat;
    double lng;
}
