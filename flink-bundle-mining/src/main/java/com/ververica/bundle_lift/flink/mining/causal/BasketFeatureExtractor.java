package com.ververica.bundle_lift.flink.mining.causal;

import com.ververica.bundle_lift.flink.mining.shared.model.Transaction;

/**
 * Numeric feature vector of one basket. Every call returns a vector of the
 * same width.
 */
@FunctionalInterface
public interface BasketFeatureExtractor {

    double[] extract(Transaction transaction);
}
