package com.ridehailing.fare.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static com.ridehailing.fare.pricing.PricingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class TimeBandsTest {

    @Test
    @DisplayName("Slot keys: first and second half of the hour, wrapping at midnight")
    void slotKeys() {
        assertThat(TimeBands.slotKey(8, 0)).isEqualTo("08:00-08:30");
        assertThat(TimeBands.slotKey(8, 29)).isEqualTo("08:00-08:30");
        assertThat(TimeBands.slotKey(8, 30)).isEqualTo("08:30-09:00");
        assertThat(TimeBands.slotKey(23, 45)).isEqualTo("23:30-00:00");
        assertThat(TimeBands.slotKey(0, 5)).isEqualTo("00:00-00:30");
    }

    @Test
    @DisplayName("Slot keys use ASCII digits whatever the default locale")
    void slotKeysIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
            assertThat(TimeBands.slotKey(8, 15)).isEqualTo("08:00-08:30");
            assertThat(TimeBands.slotKey(monday(18, 40))).isEqualTo("18:30-19:00");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Weekend is Saturday and Sunday")
    void weekend() {
        assertThat(TimeBands.isWeekend(monday(12, 0))).isFalse();
        assertThat(TimeBands.isWeekend(at(19, 12, 0))).isFalse();
        assertThat(TimeBands.isWeekend(saturday(12, 0))).isTrue();
        assertThat(TimeBands.isWeekend(at(21, 12, 0))).isTrue();
    }

    @Test
    @DisplayName("Late night is 23:00 through 05:59")
    void lateNight() {
        assertThat(TimeBands.isLateNight(23)).isTrue();
        assertThat(TimeBands.isLateNight(5)).isTrue();
        assertThat(TimeBands.isLateNight(6)).isFalse();
        assertThat(TimeBands.isLateNight(22)).isFalse();
    }

    @Test
    @DisplayName("Peak commute is 7-9 and 17-19 on weekdays only")
    void peakCommute() {
        assertThat(TimeBands.isPeakCommute(7, false)).isTrue();
        assertThat(TimeBands.isPeakCommute(9, false)).isTrue();
        assertThat(TimeBands.isPeakCommute(10, false)).isFalse();
        assertThat(TimeBands.isPeakCommute(19, false)).isTrue();
        assertThat(TimeBands.isPeakCommute(20, false)).isFalse();
        assertThat(TimeBands.isPeakCommute(8, true)).isFalse();
    }
}
