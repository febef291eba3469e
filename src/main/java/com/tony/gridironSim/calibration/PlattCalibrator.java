package com.tony.gridironSim.calibration;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

import java.util.List;

/**
 * Platt scaling : P = 1 / (1 + exp(-(a + b·z))).
 * a et b maximisent la log-vraisemblance, avec une légère pénalité L2
 * pour rester fini quand l'historique est parfaitement séparable.
 */
public final class PlattCalibrator implements ProbabilityCalibrator {

    static final double DEFAULT_REGULARIZATION = 1e-2;
    private static final double EPS = 1e-12;

    private final double intercept;
    private final double slope;

    PlattCalibrator(double intercept, double slope) {
        this.intercept = intercept;
        this.slope = slope;
    }

    public static PlattCalibrator fit(List<CalibrationSample> samples) {
        return fit(samples, DEFAULT_REGULARIZATION);
    }

    public static PlattCalibrator fit(List<CalibrationSample> samples, double regularization) {
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Aucun échantillon pour ajuster la calibration");
        }
        MultivariateFunction logLikelihood = point -> {
            double ll = 0.0;
            for (CalibrationSample s : samples) {
                double p = Math.min(1 - EPS, Math.max(EPS, sigmoid(point[0] + point[1] * s.z())));
                ll += s.outcome() * Math.log(p) + (1 - s.outcome()) * Math.log(1 - p);
            }
            return ll - regularization * (point[0] * point[0] + point[1] * point[1]);
        };

        SimplexOptimizer optimizer = new SimplexOptimizer(1e-10, 1e-30);
        PointValuePair optimum = optimizer.optimize(
                new MaxEval(50_000),
                new ObjectiveFunction(logLikelihood),
                GoalType.MAXIMIZE,
                new InitialGuess(new double[]{0.0, 1.0}),
                new NelderMeadSimplex(2));

        double[] point = optimum.getPoint();
        return new PlattCalibrator(point[0], point[1]);
    }

    @Override
    public double probability(double z) {
        return sigmoid(intercept + slope * z);
    }

    @Override
    public CalibrationMethod method() {
        return CalibrationMethod.PLATT;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getSlope() {
        return slope;
    }

    private static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
