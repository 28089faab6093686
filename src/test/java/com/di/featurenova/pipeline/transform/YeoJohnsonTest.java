package com.di.featurenova.pipeline.transform;

import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YeoJohnson Tests")
class YeoJohnsonTest {

    /** exp(i / 5) for i in [0, 40): long right tail. */
    private static double[] rightSkewed() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.exp(i / 5.0);
        }
        return values;
    }

    // =========================================================================
    // Transform
    // =========================================================================

    @ParameterizedTest
    @ValueSource(doubles = {-3.0, -0.5, 0.0, 2.5, 40.0})
    @DisplayName("Should be the identity at lambda 1")
    void testApply_IdentityAtOne(double y) {
        assertEquals(y, YeoJohnson.apply(y, 1.0), 1e-12);
    }

    @Test
    @DisplayName("Should use the logarithmic branches at lambda 0 and 2")
    void testApply_LogBranches() {
        assertEquals(1.0, YeoJohnson.apply(Math.E - 1, 0.0), 1e-12);
        assertEquals(-1.0, YeoJohnson.apply(-(Math.E - 1), 2.0), 1e-12);
    }

    @Test
    @DisplayName("Should follow the power branches away from lambda 0 and 2")
    void testApply_PowerBranches() {
        assertEquals((Math.pow(4, 0.5) - 1) / 0.5, YeoJohnson.apply(3.0, 0.5), 1e-12);
        assertEquals(-(Math.pow(4, 1.5) - 1) / 1.5, YeoJohnson.apply(-3.0, 0.5), 1e-12);
    }

    // =========================================================================
    // Lambda fit
    // =========================================================================

    @Test
    @DisplayName("Should pick a lambda below 1 that reduces right skew")
    void testFitLambda_RightSkewed() {
        double[] values = rightSkewed();

        double lambda = YeoJohnson.fitLambda(values);
        double[] transformed = Arrays.stream(values).map(v -> YeoJohnson.apply(v, lambda)).toArray();

        assertTrue(lambda < 1.0, "lambda " + lambda);
        Skewness skewness = new Skewness();
        assertTrue(Math.abs(skewness.evaluate(transformed)) < Math.abs(skewness.evaluate(values)));
    }

    @Test
    @DisplayName("Should maximise the log-likelihood")
    void testFitLambda_MaximisesLikelihood() {
        double[] values = rightSkewed();
        double lambda = YeoJohnson.fitLambda(values);
        double best = YeoJohnson.logLikelihood(values, lambda);

        for (double other : new double[] {YeoJohnson.LAMBDA_MIN, -1.0, 0.0, 1.0, 2.0, YeoJohnson.LAMBDA_MAX}) {
            assertTrue(best >= YeoJohnson.logLikelihood(values, other) - 1e-9, "lambda " + other);
        }
        assertEquals(lambda, YeoJohnson.fitLambda(values));
    }

    @Test
    @DisplayName("Should need at least two values")
    void testFitLambda_TooFewValues() {
        assertThrows(IllegalArgumentException.class, () -> YeoJohnson.fitLambda(new double[] {1.0}));
    }
}
