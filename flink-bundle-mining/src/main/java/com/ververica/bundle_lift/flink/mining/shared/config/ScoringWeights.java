package com.ververica.bundle_lift.flink.mining.shared.config;

import java.io.Serializable;

/**
 * Weight vector of the multi-objective score.
 *
 * overall = lift * norm(lift) + profit * norm(profit) + diversity * diversity + confidence * confidence
 *
 * The four weights must be non-negative and sum to 1 within {@link #TOLERANCE}.
 */
public final class ScoringWeights implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double TOLERANCE = 0.001;

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.30, 0.40, 0.15, 0.15);

    private final double lift;
    private final double profit;
    private final double diversity;
    private final double confidence;

    public ScoringWeights(double lift, double profit, double diversity, double confidence) {
        this.lift = lift;
        this.profit = profit;
        this.diversity = diversity;
        this.confidence = confidence;
        validate();
    }

    /**
     * @throws ConfigurationException if a weight is negative or the sum is not 1
     */
    private void validate() {
        double[] all = {lift, profit, diversity, confidence};
        for (double weight : all) {
            if (weight < 0.0 || Double.isNaN(weight)) {
                throw new ConfigurationException("Scoring weights must be non-negative: " + this);
            }
        }
        double total = lift + profit + diversity + confidence;
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw new ConfigurationException(
                String.format("Scoring weights must sum to 1.0 (got %.4f): %s", total, this));
        }
    }

    public double getLift() {
        return lift;
    }

    public double getProfit() {
        return profit;
    }

    public double getDiversity() {
        return diversity;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return String.format("ScoringWeights{lift=%.3f, profit=%.3f, diversity=%.3f, confidence=%.3f}",
            lift, profit, diversity, confidence);
    }
}
