package com.sonicgalaxy.app.service.embedding;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * PCA through a thin SVD of the mean-centred data.
 * <p>
 * Components are ordered by decreasing singular value and sign-normalized so that the
 * largest-magnitude loading of each component is positive, which keeps projections
 * reproducible across runs. Requested components beyond the data's rank come back as
 * zero columns with zero explained variance.
 */
@Component
public class PrincipalComponents {

    @Value
    public static class Projection {
        double[][] scores;
        double[] explainedVarianceRatio;
    }

    public Projection fit(double[][] data, int components) {
        int rows = data.length;
        int cols = rows == 0 ? 0 : data[0].length;
        double[][] scores = new double[rows][components];
        double[] ratio = new double[components];
        if (rows == 0 || cols == 0 || components <= 0) {
            return new Projection(scores, ratio);
        }

        double[][] centred = centre(data);
        DMatrixRMaj matrix = new DMatrixRMaj(centred);
        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(rows, cols, false, true, true));
        if (!svd.decompose(matrix)) {
            throw new IllegalStateException("SVD did not converge on " + rows + "x" + cols + " matrix");
        }

        double[] singular = svd.getSingularValues();
        int available = svd.numberOfSingularValues();
        DMatrixRMaj v = svd.getV(null, false);

        Integer[] order = IntStream.range(0, available).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> singular[i]).reversed());

        double total = 0.0;
        for (int i = 0; i < available; i++) {
            total += singular[i] * singular[i];
        }

        int kept = Math.min(components, available);
        for (int k = 0; k < kept; k++) {
            int component = order[k];
            double[] loading = new double[cols];
            for (int j = 0; j < cols; j++) {
                loading[j] = v.get(j, component);
            }
            flipSign(loading);

            for (int r = 0; r < rows; r++) {
                double acc = 0.0;
                for (int j = 0; j < cols; j++) {
                    acc += centred[r][j] * loading[j];
                }
                scores[r][k] = acc;
            }
            ratio[k] = total > 0 ? singular[component] * singular[component] / total : 0.0;
        }
        return new Projection(scores, ratio);
    }

    private static double[][] centre(double[][] data) {
        int rows = data.length;
        int cols = data[0].length;
        double[] mean = new double[cols];
        for (double[] row : data) {
            for (int j = 0; j < cols; j++) {
                mean[j] += row[j] / rows;
            }
        }
        double[][] centred = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int j = 0; j < cols; j++) {
                centred[r][j] = data[r][j] - mean[j];
            }
        }
        return centred;
    }

    private static void flipSign(double[] loading) {
        int dominant = 0;
        for (int j = 1; j < loading.length; j++) {
            if (Math.abs(loading[j]) > Math.abs(loading[dominant])) {
                dominant = j;
            }
        }
        if (loading[dominant] < 0) {
            for (int j = 0; j < loading.length; j++) {
                loading[j] = -loading[j];
            }
        }
    }
}
