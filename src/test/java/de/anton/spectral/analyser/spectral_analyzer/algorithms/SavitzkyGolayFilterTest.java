package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SavitzkyGolayFilterTest {

    private static final double TOL = 1e-8;

    private static double[] polynomial(int length, double... coefficients) {
        double[] values = new double[length];
        for (int j = 0; j < length; j++) {
            double v = 0;
            for (int p = 0; p < coefficients.length; p++) v += coefficients[p] * Math.pow(j, p);
            values[j] = v;
        }
        return values;
    }

    @Test
    void quadraticCubicWeightsMatchClassicTable() {
        SavitzkyGolayFilter filter = new SavitzkyGolayFilter(0, 2, 5);
        double[] expected = { -3 / 35.0, 12 / 35.0, 17 / 35.0, 12 / 35.0, -3 / 35.0 };
        assertArrayEquals(expected, filter.centreWeights(), 1e-12);
    }

    @Test
    void smoothingPreservesPolynomialsUpToOrderIncludingEdges() {
        double[] quadratic = polynomial(15, 1.5, -0.4, 0.25);
        double[] smoothed = new SavitzkyGolayFilter(0, 2, 7).apply(quadratic);
        assertArrayEquals(quadratic, smoothed, TOL);
    }

    @Test
    void firstDerivativeOfCubicIsExact() {
        double[] cubic = polynomial(20, 2.0, 1.0, -0.5, 0.1);
        double[] derivative = new SavitzkyGolayFilter(1, 3, 7).apply(cubic);
        for (int j = 0; j < cubic.length; j++) {
            double expected = 1.0 - 1.0 * j + 0.3 * j * j;
            assertEquals(expected, derivative[j], 1e-7, "channel " + j);
        }
    }

    @Test
    void secondDerivativeOfQuadraticIsConstant() {
        double[] quadratic = polynomial(12, 0.0, 3.0, 0.75);
        double[] second = new SavitzkyGolayFilter(2, 2, 5).apply(quadratic);
        for (double v : second) {
            assertEquals(1.5, v, TOL);
        }
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(3, 2, 7));
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(0, 2, 6));
        assertThrows(IllegalArgumentException.class, () -> new SavitzkyGolayFilter(0, 3, 3));
        SavitzkyGolayFilter filter = new SavitzkyGolayFilter(0, 2, 9);
        assertThrows(IllegalArgumentException.class, () -> filter.apply(new double[5]));
    }
}
