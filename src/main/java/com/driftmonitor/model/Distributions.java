package com.driftmonitor.model;

import java.util.Optional;

/**
 * Shape checks shared by baselines and observation batches.
 */
public final class Distributions {

    private Distributions() {}

    /**
     * Returns a description of the first violated probability-vector invariant,
     * or empty when {@code p} is non-empty, finite, non-negative and sums to 1
     * within {@code tolerance}.
     */
    public static Optional<String> violation(double[] p, double tolerance) {
        if (p == null || p.length == 0) {
            return Optional.of("distribution is empty");
        }
        double sum = 0.0;
        for (int i = 0; i < p.length; i++) {
            if (!Double.isFinite(p[i])) {
                return Optional.of("entry " + i + " is not finite");
            }
            if (p[i] < 0.0) {
                return Optional.of("entry " + i + " is negative (" + p[i] + ")");
            }
            sum += p[i];
        }
        if (Math.abs(sum - 1.0) > tolerance) {
            return Optional.of("entries sum to " + sum + ", expected 1 within " + tolerance);
        }
        return Optional.empty();
    }

    public static double[] mean(Iterable<double[]> vectors, int dimension) {
        double[] acc = new double[dimension];
        int n = 0;
        for (double[] v : vectors) {
            for (int i = 0; i < dimension; i++) {
                acc[i] += v[i];
            }
            n++;
        }
        if (n == 0) {
            throw new IllegalArgumentException("cannot average an empty set of vectors");
        }
        for (int i = 0; i < dimension; i++) {
            acc[i] /= n;
        }
        return acc;
    }
}
