package com.ridehailing.fare.pricing;

import com.ridehailing.fare.pricing.config.TrafficModifiers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrafficAdjusterTest {

    private final TrafficAdjuster adjuster = new TrafficAdjuster(
            TrafficModifiers.builder().light(1.0).moderate(1.1).heavy(1.25).severe(1.4).build());

    @Test
    @DisplayName("Band boundaries: ≤1.1 light, ≤1.3 moderate, ≤1.6 heavy, above severe")
    void bands() {
        assertThat(adjuster.classify(990.0, 900.0)).isEqualTo(TrafficBand.LIGHT);
        assertThat(adjuster.classify(1170.0, 900.0)).isEqualTo(TrafficBand.MODERATE);
        assertThat(adjuster.classify(1440.0, 900.0)).isEqualTo(TrafficBand.HEAVY);
        assertThat(adjuster.classify(1441.0, 900.0)).isEqualTo(TrafficBand.SEVERE);
    }

    @Test
    @DisplayName("Ratio 1.5 → heavy → 1.25")
    void heavyMultiplier() {
        assertThat(adjuster.multiplierFor(adjuster.classify(1350.0, 900.0))).isEqualTo(1.25);
    }

    @Test
    @DisplayName("Faster than expected is light traffic, multiplier 1.0")
    void fasterThanExpected() {
        assertThat(adjuster.multiplierFor(adjuster.classify(600.0, 900.0))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Missing or non-positive durations → no data → 1.0")
    void noData() {
        assertThat(adjuster.classify(null, 900.0)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(900.0, null)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(900.0, 0.0)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(-5.0, 900.0)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.multiplierFor(TrafficBand.NO_DATA)).isEqualTo(1.0);
        assertThat(TrafficBand.NO_DATA.label()).isEqualTo("none");
    }

    @Test
    @DisplayName("NaN or infinite durations are no data, not severe traffic")
    void nonFiniteDurations() {
        assertThat(adjuster.classify(Double.NaN, 900.0)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(900.0, Double.NaN)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(Double.POSITIVE_INFINITY, 900.0)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.classify(900.0, Double.POSITIVE_INFINITY)).isEqualTo(TrafficBand.NO_DATA);
        assertThat(adjuster.multiplierFor(adjuster.classify(Double.NaN, Double.NaN))).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Only heavy and severe count as congested")
    void congested() {
        assertThat(TrafficBand.MODERATE.isCongested()).isFalse();
        assertThat(TrafficBand.HEAVY.isCongested()).isTrue();
        assertThat(TrafficBand.SEVERE.isCongested()).isTrue();
    }
}
