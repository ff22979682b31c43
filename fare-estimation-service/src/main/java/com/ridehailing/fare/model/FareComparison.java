package com.ridehailing.fare.model;

import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;
import java.util.List;

@Data
@Builder
public class FareComparison {
    private List<RideOption> options;
    private String cheapestService;
    private SurgeInfo surge;
    private List<String> timeRecommendations;
    private double distanceKm;
    private ZonedDateTime requestedAt;

    /** H3 cell of the pickup; callers key persisted price snapshots by it. */
    private String pickupCell;
}
