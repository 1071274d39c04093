package com.bmsedge.forecast.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VolatilityEstimatorTest {

    @Test
    @DisplayName("Should compute population standard deviation over mean as a percentage")
    void testVolatilityPercent() {
        // mean 5, population stddev 2
        double volatility = VolatilityEstimator.volatilityPercent(new double[]{2, 4, 4, 4, 5, 5, 7, 9});

        assertEquals(40.0, volatility, 1e-9);
    }

    @Test
    @DisplayName("Should return zero for short, constant and zero-mean series")
    void testDegenerateSeries() {
        assertEquals(0.0, VolatilityEstimator.volatilityPercent(new double[]{}));
        assertEquals(0.0, VolatilityEstimator.volatilityPercent(new double[]{123}));
        assertEquals(0.0, VolatilityEstimator.volatilityPercent(new double[]{100, 100, 100, 100}));
        assertEquals(0.0, VolatilityEstimator.volatilityPercent(new double[]{-5, 5}));
    }

    @Test
    @DisplayName("Should not overflow for values near the top of the double range")
    void testVeryLargeValues() {
        double volatility = VolatilityEstimator.volatilityPercent(new double[]{1e200, 3e200, 2e200});

        assertEquals(Math.sqrt(2.0 / 3.0) / 2 * 100, volatility, 1e-9);
    }

    @Test
    @DisplayName("Should never report negative volatility")
    void testNegativeMean() {
        double volatility = VolatilityEstimator.volatilityPercent(new double[]{-2, -4, -6});

        assertEquals(0.0, volatility);
    }
}
