package com.tony.gridironSim.engine;

import java.util.SplittableRandom;

/**
 * Tirages aléatoires utilisés par le moteur. Toujours à partir du RNG de l'essai.
 */
final class Distributions {

    private Distributions() {
    }

    static boolean bernoulli(SplittableRandom rng, double p) {
        return rng.nextDouble() < p;
    }

    static double normal(SplittableRandom rng, double mean, double sd) {
        return mean + sd * rng.nextGaussian();
    }

    /**
     * Gamma de forme 2 (somme de deux exponentielles) : asymétrique à droite, toujours positive.
     */
    static double gamma2(SplittableRandom rng, double mean) {
        double u1 = 1.0 - rng.nextDouble();
        double u2 = 1.0 - rng.nextDouble();
        return -(mean / 2.0) * (Math.log(u1) + Math.log(u2));
    }

    static double logNormal(SplittableRandom rng, double median, double sigma) {
        return median * Math.exp(sigma * rng.nextGaussian());
    }

    /**
     * Arrondi stochastique : E[résultat] = x.
     */
    static int stochasticRound(SplittableRandom rng, double x) {
        double floor = Math.floor(x);
        return (int) floor + (rng.nextDouble() < x - floor ? 1 : 0);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
