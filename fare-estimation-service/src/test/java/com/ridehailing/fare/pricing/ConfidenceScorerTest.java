package com.ridehailing.fare.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    @DisplayName("Short daytime trip, no surge, no traffic data → 0.9")
    void baseline() {
        assertThat(scorer.score(10, 1.0, TrafficBand.NO_DATA, 14)).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Distance penalties: >25 km −0.10, >50 km −0.15 (not both)")
    void distance() {
        assertThat(scorer.score(25, 1.0, TrafficBand.LIGHT, 14)).isEqualTo(0.9);
        assertThat(scorer.score(25.1, 1.0, TrafficBand.LIGHT, 14)).isEqualTo(0.8);
        assertThat(scorer.score(50, 1.0, TrafficBand.LIGHT, 14)).isEqualTo(0.8);
        assertThat(scorer.score(50.1, 1.0, TrafficBand.LIGHT, 14)).isEqualTo(0.75);
    }

    @Test
    @DisplayName("Surge above 2.0 −0.10; exactly 2.0 is not penalised")
    void surge() {
        assertThat(scorer.score(10, 2.0, TrafficBand.LIGHT, 14)).isEqualTo(0.9);
        assertThat(scorer.score(10, 2.1, TrafficBand.LIGHT, 14)).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Heavy or severe traffic −0.10; moderate is free")
    void traffic() {
        assertThat(scorer.score(10, 1.0, TrafficBand.MODERATE, 14)).isEqualTo(0.9);
        assertThat(scorer.score(10, 1.0, TrafficBand.HEAVY, 14)).isEqualTo(0.8);
        assertThat(scorer.score(10, 1.0, TrafficBand.SEVERE, 14)).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Hours 1-5 −0.10; midnight and 06:00 are not penalised")
    void smallHours() {
        assertThat(scorer.score(10, 1.0, TrafficBand.LIGHT, 0)).isEqualTo(0.9);
        assertThat(scorer.score(10, 1.0, TrafficBand.LIGHT, 1)).isEqualTo(0.8);
        assertThat(scorer.score(10, 1.0, TrafficBand.LIGHT, 5)).isEqualTo(0.8);
        assertThat(scorer.score(10, 1.0, TrafficBand.LIGHT, 6)).isEqualTo(0.9);
    }

    @Test
    @DisplayName("All penalties together are floored at 0.5")
    void floor() {
        // 0.90 - 0.15 - 0.10 - 0.10 - 0.10 = 0.45 → 0.5
        assertThat(scorer.score(80, 2.2, TrafficBand.SEVERE, 3)).isEqualTo(0.5);
    }
}
