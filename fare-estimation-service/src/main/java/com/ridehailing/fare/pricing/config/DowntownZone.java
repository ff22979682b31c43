package com.ridehailing.fare.pricing.config;

import com.ridehailing.fare.pricing.Coordinates;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Central business district bounding box. Edges are inclusive.
 */
@Value
@Builder
@Jacksonized
public class DowntownZone {

    String name;
    double minLat;
    double maxLat;
    double minLng;
    double maxLng;

    public boolean contains(Coordinates point) {
        return point.getLat() >= minLat && point.getLat() <= maxLat
                && point.getLng() >= minLng && point.getLng() <= maxLng;
    }
}
