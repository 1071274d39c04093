package com.bmsedge.forecast.engine;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Fixed retail seasonality tables: low after the holidays, rising into Q4.
 * Month indexes are zero-based (0 = January).
 */
public final class SeasonalProfile {

    private static final double[] MONTHLY_FACTORS = {
            0.8,  // Jan
            0.7,  // Feb
            0.9,  // Mar
            1.1,  // Apr
            1.2,  // May
            1.3,  // Jun
            1.1,  // Jul
            1.0,  // Aug
            0.9,  // Sep
            1.1,  // Oct
            1.4,  // Nov
            1.6   // Dec
    };

    public static final double WEEKEND_FACTOR = 0.7;

    // First match wins
    public static final List<HolidayWindow> HOLIDAY_WINDOWS = List.of(
            new HolidayWindow("Black Friday", 10, 20, 30, 1.5),
            new HolidayWindow("December", 11, 1, 31, 1.8),
            new HolidayWindow("New Year", 0, 1, 5, 1.3),
            new HolidayWindow("Valentine's Day", 1, 10, 18, 1.2),
            new HolidayWindow("Mother's Day", 4, 10, 20, 1.1)
    );

    private SeasonalProfile() {
    }

    public static double monthlyFactor(int monthIndex) {
        if (monthIndex < 0 || monthIndex >= MONTHLY_FACTORS.length) {
            throw new IllegalArgumentException("Month index must be between 0 and 11: " + monthIndex);
        }
        return MONTHLY_FACTORS[monthIndex];
    }

    public static double weekendFactor(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? WEEKEND_FACTOR : 1.0;
    }

    /**
     * Holiday multiplier for synthetic series generation. Not part of {@link #seasonalComponent}.
     */
    public static double holidayFactor(LocalDate date) {
        for (HolidayWindow window : HOLIDAY_WINDOWS) {
            if (window.contains(date)) {
                return window.getMultiplier();
            }
        }
        return 1.0;
    }

    public static double seasonalComponent(LocalDate date, double value) {
        return value * monthlyFactor(date.getMonthValue() - 1) * weekendFactor(date);
    }

    public static double[] monthlyFactors() {
        return MONTHLY_FACTORS.clone();
    }
}
