package com.ridehailing.fare.pricing;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Broad time-of-day bands shared by the surge, CBD, confidence and advice rules.
 * All bounds are inclusive hours of the request's local time.
 */
public final class TimeBands {

    private TimeBands() {}

    public static boolean isWeekend(ZonedDateTime time) {
        DayOfWeek day = time.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public static boolean isLateNight(int hour) {
        return hour >= 23 || hour <= 5;
    }

    public static boolean isPeakCommute(int hour, boolean weekend) {
        return !weekend && ((hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19));
    }

    public static boolean isBusinessHours(int hour) {
        return hour >= 9 && hour <= 17;
    }

    public static boolean isNightlife(int hour) {
        return hour >= 20 || hour <= 2;
    }

    /**
     * Half-hour slot containing the given time, e.g. 08:15 → "08:00-08:30", 23:45 → "23:30-00:00".
     */
    public static String slotKey(int hour, int minute) {
        boolean firstHalf = minute < 30;
        int endHour = firstHalf ? hour : (hour + 1) % 24;
        return String.format(Locale.ROOT, "%02d:%s-%02d:%s",
                hour, firstHalf ? "00" : "30",
                endHour, firstHalf ? "30" : "00");
    }

    public static String slotKey(ZonedDateTime time) {
        return slotKey(time.getHour(), time.getMinute());
    }
}
