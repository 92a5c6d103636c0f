package com.sonicgalaxy.app.service.embedding;

import com.sonicgalaxy.app.ProfileFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TsneEmbeddingTest {

    private final TsneEmbedding tsne = new TsneEmbedding(ProfileFixtures.fastProperties(), new PrincipalComponents());

    @Test
    void jointProbabilitiesAreSymmetricAndNormalized() {
        double[][] points = {{0, 0}, {1, 0}, {0, 1}, {5, 5}, {6, 5}};

        double[][] p = TsneEmbedding.jointProbabilities(TsneEmbedding.squaredDistances(points), 2.0);

        double total = 0.0;
        for (int i = 0; i < p.length; i++) {
            assertEquals(0.0, p[i][i]);
            for (int j = 0; j < p.length; j++) {
                assertEquals(p[i][j], p[j][i], 1e-15);
                total += p[i][j];
            }
        }
        assertEquals(1.0, total, 1e-6);
        assertTrue(p[0][1] > p[0][3], "near pair must outweigh far pair");
    }

    @Test
    void separatedGroupsStaySeparated() {
        double[][] vectors = new double[8][];
        for (int i = 0; i < 4; i++) {
            vectors[i] = new double[]{i * 0.1, 0, 0, 0, 0};
            vectors[i + 4] = new double[]{10 + i * 0.1, 10, 10, 10, 10};
        }

        double[][] y = tsne.embed(vectors);

        double within = 0.0;
        double across = 0.0;
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 4; j++) {
                if (i != j) {
                    within += distance(y[i], y[j]) + distance(y[i + 4], y[j + 4]);
                }
                across += distance(y[i], y[j + 4]);
            }
        }
        assertTrue(within / 24 < across / 16);
    }

    @Test
    void outputIsFiniteAndThreeDimensional() {
        double[][] vectors = new double[6][];
        for (int i = 0; i < vectors.length; i++) {
            vectors[i] = new double[]{Math.sin(i), Math.cos(i), i * 0.2};
        }

        double[][] y = tsne.embed(vectors);

        assertEquals(6, y.length);
        for (double[] row : y) {
            assertEquals(EmbeddingStrategy.DIMENSIONS, row.length);
            for (double value : row) {
                assertTrue(Double.isFinite(value));
            }
        }
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            sum += (a[d] - b[d]) * (a[d] - b[d]);
        }
        return Math.sqrt(sum);
    }
}
