package com.sonicgalaxy.app.service.embedding;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeatureStandardizerTest {

    private final FeatureStandardizer standardizer = new FeatureStandardizer();

    @Test
    void columnsGetZeroMeanAndUnitPopulationDeviation() {
        double[][] scaled = standardizer.standardize(new double[][]{{1, 10}, {2, 20}, {3, 30}});

        double expected = 1.0 / Math.sqrt(2.0 / 3.0);
        assertEquals(-expected, scaled[0][0], 1e-12);
        assertEquals(0.0, scaled[1][0], 1e-12);
        assertEquals(expected, scaled[2][0], 1e-12);
        assertEquals(scaled[2][0], scaled[2][1], 1e-12);
    }

    @Test
    void constantColumnBecomesZero() {
        double[][] scaled = standardizer.standardize(new double[][]{{5, 1}, {5, 2}});

        assertEquals(0.0, scaled[0][0]);
        assertEquals(0.0, scaled[1][0]);
        assertEquals(-1.0, scaled[0][1], 1e-12);
        assertEquals(1.0, scaled[1][1], 1e-12);
    }

    @Test
    void singleRowIsAllZeros() {
        double[][] scaled = standardizer.standardize(new double[][]{{0.3, -2.0, 7.0}});

        assertArrayEquals(new double[]{0, 0, 0}, scaled[0]);
    }
}
