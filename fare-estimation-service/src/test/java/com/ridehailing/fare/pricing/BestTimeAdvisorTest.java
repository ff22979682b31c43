package com.ridehailing.fare.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ridehailing.fare.pricing.PricingFixtures.monday;
import static org.assertj.core.api.Assertions.assertThat;

class BestTimeAdvisorTest {

    private final BestTimeAdvisor advisor = new BestTimeAdvisor();

    @Test
    @DisplayName("14-16 → off-peak copy")
    void offPeak() {
        assertThat(advisor.recommendationsFor(monday(15, 59)))
                .containsExactly("Great timing! You're booking during off-peak hours",
                        "Best prices are typically 2-4 PM (avoid rush hours for savings)");
    }

    @Test
    @DisplayName("7-9 → morning rush copy plus best-time tip")
    void morningRush() {
        assertThat(advisor.recommendationsFor(monday(7, 0)))
                .containsExactly("Rush hour pricing in effect. Expect 15-25% increase over standard rates",
                        BestTimeAdvisor.BEST_PRICES_TIP);
    }

    @Test
    @DisplayName("17-19 → evening rush copy")
    void eveningRush() {
        assertThat(advisor.recommendationsFor(monday(19, 30)).get(0))
                .isEqualTo("Evening rush pricing. Consider waiting until after 8 PM for better rates");
    }

    @Test
    @DisplayName("20-5 → late night copy")
    void lateNight() {
        assertThat(advisor.recommendationsFor(monday(20, 0)).get(0))
                .isEqualTo("Late night premium in effect (up to 20% increase)");
        assertThat(advisor.recommendationsFor(monday(5, 0)).get(0))
                .isEqualTo("Late night premium in effect (up to 20% increase)");
    }

    @Test
    @DisplayName("Other hours → default tips, two entries")
    void defaultTips() {
        assertThat(advisor.recommendationsFor(monday(11, 0)))
                .containsExactly(BestTimeAdvisor.BEST_PRICES_TIP,
                        "Avoid rush hours: 7-9 AM and 5-7 PM (up to 25% increase)");
        assertThat(advisor.recommendationsFor(monday(6, 0))).hasSize(2);
    }
}
