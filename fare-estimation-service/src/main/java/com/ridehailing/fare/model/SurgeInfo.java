package com.ridehailing.fare.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SurgeInfo {
    private double multiplier;
    private String reason;
    private boolean active;
}
