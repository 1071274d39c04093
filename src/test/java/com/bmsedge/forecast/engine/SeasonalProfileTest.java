package com.bmsedge.forecast.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class SeasonalProfileTest {

    @Test
    @DisplayName("Should expose the retail monthly table")
    void testMonthlyFactors() {
        assertArrayEquals(new double[]{0.8, 0.7, 0.9, 1.1, 1.2, 1.3, 1.1, 1.0, 0.9, 1.1, 1.4, 1.6},
                SeasonalProfile.monthlyFactors());
        assertEquals(0.7, SeasonalProfile.monthlyFactor(1));
        assertEquals(1.6, SeasonalProfile.monthlyFactor(11));
        assertThrows(IllegalArgumentException.class, () -> SeasonalProfile.monthlyFactor(12));
    }

    @Test
    @DisplayName("Monthly table copies should not leak into the profile")
    void testMonthlyFactorsAreImmutable() {
        double[] copy = SeasonalProfile.monthlyFactors();
        copy[0] = 99;

        assertEquals(0.8, SeasonalProfile.monthlyFactor(0));
    }

    @Test
    @DisplayName("Should damp weekends only")
    void testWeekendFactor() {
        assertEquals(0.7, SeasonalProfile.weekendFactor(LocalDate.of(2024, 3, 16))); // Saturday
        assertEquals(0.7, SeasonalProfile.weekendFactor(LocalDate.of(2024, 3, 17))); // Sunday
        assertEquals(1.0, SeasonalProfile.weekendFactor(LocalDate.of(2024, 3, 18))); // Monday
    }

    @Test
    @DisplayName("Should match each holiday window")
    void testHolidayFactor() {
        assertEquals(1.5, SeasonalProfile.holidayFactor(LocalDate.of(2024, 11, 25)));
        assertEquals(1.0, SeasonalProfile.holidayFactor(LocalDate.of(2024, 11, 19)));
        assertEquals(1.8, SeasonalProfile.holidayFactor(LocalDate.of(2024, 12, 1)));
        assertEquals(1.8, SeasonalProfile.holidayFactor(LocalDate.of(2024, 12, 31)));
        assertEquals(1.3, SeasonalProfile.holidayFactor(LocalDate.of(2025, 1, 5)));
        assertEquals(1.0, SeasonalProfile.holidayFactor(LocalDate.of(2025, 1, 6)));
        assertEquals(1.2, SeasonalProfile.holidayFactor(LocalDate.of(2024, 2, 14)));
        assertEquals(1.1, SeasonalProfile.holidayFactor(LocalDate.of(2024, 5, 15)));
        assertEquals(1.0, SeasonalProfile.holidayFactor(LocalDate.of(2024, 3, 15)));
    }

    @Test
    @DisplayName("Seasonal component should combine month and weekend but not holidays")
    void testSeasonalComponentExcludesHolidays() {
        // Christmas Day 2024 is a Wednesday inside the December holiday window
        assertEquals(160.0, SeasonalProfile.seasonalComponent(LocalDate.of(2024, 12, 25), 100), 1e-9);

        // Saturday in March
        assertEquals(63.0, SeasonalProfile.seasonalComponent(LocalDate.of(2024, 3, 16), 100), 1e-9);
    }
}
