package com.ververica.bundle_lift.flink.mining.ml;

/**
 * Binary outcome-probability estimator.
 *
 * Two independent instances are trained on the control and treatment arms
 * of an uplift estimate; they must not share any parameters.
 */
public interface OutcomeEstimator {

    /**
     * @param features one row per sample, all rows of equal width
     * @param outcomes 0 or 1 per sample
     * @throws IllegalArgumentException on empty or mismatched input
     */
    void fit(double[][] features, int[] outcomes);

    /**
     * Probability of outcome 1, in [0,1].
     *
     * @throws IllegalStateException if called before {@link #fit}
     */
    double predictProbability(double[] features);
}
