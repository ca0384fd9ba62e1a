package com.ververica.bundle_lift.flink.mining.shared.model;

/**
 * Lifecycle of a rule's uplift estimate.
 *
 * <pre>
 * NOT_ESTIMATED → ESTIMATING → ESTIMATED
 *                            → INSUFFICIENT_DATA
 * </pre>
 */
public enum UpliftStatus {
    NOT_ESTIMATED,
    ESTIMATING,
    ESTIMATED,
    INSUFFICIENT_DATA;

    public boolean isTerminal() {
        return this == ESTIMATED || this == INSUFFICIENT_DATA;
    }
}
