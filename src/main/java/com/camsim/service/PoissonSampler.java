package com.camsim.service;

import java.util.Random;

/**
 * Muestreo de Poisson con generador explicito. Media pequena: metodo multiplicativo de Knuth.
 * Media grande: rechazo transformado (PTRS, Hormann 1993).
 */
final class PoissonSampler {

    private static final double SMALL_MEAN = 30.0;
    private static final double HALF_LOG_2PI = 0.5 * Math.log(2 * Math.PI);
    private static final double[] LOG_FACTORIAL = new double[10];

    static {
        for (int k = 1; k < LOG_FACTORIAL.length; k++) LOG_FACTORIAL[k] = LOG_FACTORIAL[k - 1] + Math.log(k);
    }

    private PoissonSampler() {
    }

    static double sample(double mean, Random rng) {
        if (!(mean > 0)) return 0;
        if (Double.isInfinite(mean)) return mean;
        return (mean < SMALL_MEAN) ? knuth(mean, rng) : ptrs(mean, rng);
    }

    private static double knuth(double mean, Random rng) {
        double limit = Math.exp(-mean);
        double p = 1.0;
        int k = -1;
        do {
            k++;
            p *= rng.nextDouble();
        } while (p > limit);
        return k;
    }

    private static double ptrs(double mean, Random rng) {
        double logMean = Math.log(mean);
        double b = 0.931 + 2.53 * Math.sqrt(mean);
        double a = -0.059 + 0.02483 * b;
        double invAlpha = 1.1239 + 1.1328 / (b - 3.4);
        double vr = 0.9277 - 3.6224 / (b - 2);

        while (true) {
            double u = rng.nextDouble() - 0.5;
            double v = rng.nextDouble();
            double us = 0.5 - Math.abs(u);
            double k = Math.floor((2 * a / us + b) * u + mean + 0.43);
            if (us >= 0.07 && v <= vr) return k;
            if (k < 0 || (us < 0.013 && v > us)) continue;
            double lhs = Math.log(v) + Math.log(invAlpha) - Math.log(a / (us * us) + b);
            double rhs = -mean + k * logMean - logFactorial(k);
            if (lhs <= rhs) return k;
        }
    }

    // Stirling para k >= 10
    static double logFactorial(double k) {
        if (k < LOG_FACTORIAL.length) return LOG_FACTORIAL[(int) k];
        double x = k + 1;
        return (x - 0.5) * Math.log(x) - x + HALF_LOG_2PI + 1.0 / (12 * x) - 1.0 / (360 * x * x * x);
    }
}
