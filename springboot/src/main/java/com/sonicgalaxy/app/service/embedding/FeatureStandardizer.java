package com.sonicgalaxy.app.service.embedding;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

/**
 * Column-wise z-score scaling with population standard deviation.
 * Constant columns come out as all zeros.
 */
@Component
public class FeatureStandardizer {

    private static final double CONSTANT_COLUMN_STD = 1e-10;

    public double[][] standardize(double[][] vectors) {
        int rows = vectors.length;
        if (rows == 0) {
            return new double[0][];
        }
        int cols = vectors[0].length;
        double[][] scaled = new double[rows][cols];

        Mean mean = new Mean();
        StandardDeviation deviation = new StandardDeviation(false);
        double[] column = new double[rows];

        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                column[r] = vectors[r][c];
            }
            double mu = mean.evaluate(column);
            double sigma = deviation.evaluate(column);
            if (sigma < CONSTANT_COLUMN_STD) {
                continue;
            }
            for (int r = 0; r < rows; r++) {
                scaled[r][c] = (column[r] - mu) / sigma;
            }
        }
        return scaled;
    }
}
