package com.bmsedge.forecast.engine;

import com.bmsedge.forecast.model.DataPoint;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds a demo daily series: a linear base trend shaped by month, weekend and holiday
 * multipliers, with up to ±10% random noise.
 */
@Component
public class SyntheticSeriesGenerator {

    private static final double BASE_VALUE = 1000;
    private static final double DAILY_GROWTH = 2;
    private static final double NOISE_AMPLITUDE = 0.2;

    private final Clock clock;

    // Null means draw from ThreadLocalRandom on every call
    private final Random random;

    @Autowired
    public SyntheticSeriesGenerator(Clock clock) {
        this(clock, null);
    }

    public SyntheticSeriesGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generate {@code days} consecutive daily points, the first one {@code days} days before today.
     */
    public List<DataPoint> generate(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("Days must not be negative: " + days);
        }

        LocalDate startDate = LocalDate.now(clock).minusDays(days);
        Random source = random != null ? random : ThreadLocalRandom.current();
        List<DataPoint> data = new ArrayList<>(days);

        for (int i = 0; i < days; i++) {
            LocalDate date = startDate.plusDays(i);
            double baseValue = BASE_VALUE + i * DAILY_GROWTH;

            double noise = (source.nextDouble() - 0.5) * NOISE_AMPLITUDE;

            double value = baseValue
                    * SeasonalProfile.monthlyFactor(date.getMonthValue() - 1)
                    * SeasonalProfile.weekendFactor(date)
                    * SeasonalProfile.holidayFactor(date)
                    * (1 + noise);

            data.add(new DataPoint(date, Math.round(value)));
        }

        return data;
    }
}
