package com.di.featurenova.pipeline.transform;

import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

/**
 * Yeo-Johnson power transform. Lambda is the maximum-likelihood estimate
 * over the training values, searched in [{@value #LAMBDA_MIN}, {@value #LAMBDA_MAX}].
 */
final class YeoJohnson {

    static final double LAMBDA_MIN = -5.0;
    static final double LAMBDA_MAX = 5.0;

    private static final double EPS             = Math.ulp(1.0);
    private static final int    MAX_EVALUATIONS = 500;

    private YeoJohnson() {
    }

    static double apply(double y, double lambda) {
        if (y >= 0) {
            return Math.abs(lambda) < EPS
                    ? Math.log1p(y)
                    : (Math.pow(y + 1, lambda) - 1) / lambda;
        }
        return Math.abs(lambda - 2) < EPS
                ? -Math.log1p(-y)
                : -(Math.pow(1 - y, 2 - lambda) - 1) / (2 - lambda);
    }

    static double fitLambda(double[] values) {
        if (values.length < 2) {
            throw new IllegalArgumentException("Need at least 2 values to fit lambda, got " + values.length);
        }
        BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-12);
        UnivariatePointValuePair best = optimizer.optimize(
                new MaxEval(MAX_EVALUATIONS),
                new UnivariateObjectiveFunction(lambda -> logLikelihood(values, lambda)),
                GoalType.MAXIMIZE,
                new SearchInterval(LAMBDA_MIN, LAMBDA_MAX));
        return best.getPoint();
    }

    /** Profile log-likelihood of {@code lambda} under a normal model of the transformed values. */
    static double logLikelihood(double[] values, double lambda) {
        int n = values.length;
        double sum = 0.0;
        double logJacobian = 0.0;
        double[] t = new double[n];
        for (int i = 0; i < n; i++) {
            t[i] = apply(values[i], lambda);
            sum += t[i];
            logJacobian += Math.copySign(Math.log1p(Math.abs(values[i])), values[i]);
        }
        double mean = sum / n;
        double sq = 0.0;
        for (double v : t) {
            sq += (v - mean) * (v - mean);
        }
        double variance = sq / n;
        if (!Double.isFinite(variance) || variance <= 0.0) {
            return -Double.MAX_VALUE;
        }
        return -0.5 * n * Math.log(variance) + (lambda - 1) * logJacobian;
    }
}
