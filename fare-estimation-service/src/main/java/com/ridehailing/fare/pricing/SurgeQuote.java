package com.ridehailing.fare.pricing;

import lombok.Value;

@Value(staticConstructor = "of")
public class SurgeQuote {
    double multiplier;
    SurgeReason reason;

    public String getSurgeReason() {
        return reason.getLabel();
    }
}
