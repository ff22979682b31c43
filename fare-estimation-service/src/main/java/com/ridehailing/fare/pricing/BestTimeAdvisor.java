package com.ridehailing.fare.pricing;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Advisory copy on when to book. Depends only on the hour, never on the trip.
 */
public class BestTimeAdvisor {

    static final String BEST_PRICES_TIP = "Best prices: 2-4 PM (avoid peak hours for savings)";

    public List<String> recommendationsFor(ZonedDateTime time) {
        int hour = time.getHour();

        if (hour >= 14 && hour <= 16) {
            return List.of(
                    "Great timing! You're booking during off-peak hours",
                    "Best prices are typically 2-4 PM (avoid rush hours for savings)");
        }
        if (hour >= 7 && hour <= 9) {
            return List.of(
                    "Rush hour pricing in effect. Expect 15-25% increase over standard rates",
                    BEST_PRICES_TIP);
        }
        if (hour >= 17 && hour <= 19) {
            return List.of(
                    "Evening rush pricing. Consider waiting until after 8 PM for better rates",
                    BEST_PRICES_TIP);
        }
        if (hour >= 20 || hour <= 5) {
            return List.of(
                    "Late night premium in effect (up to 20% increase)",
                    BEST_PRICES_TIP);
        }
        return List.of(
                BEST_PRICES_TIP,
                "Avoid rush hours: 7-9 AM and 5-7 PM (up to 25% increase)");
    }
}
