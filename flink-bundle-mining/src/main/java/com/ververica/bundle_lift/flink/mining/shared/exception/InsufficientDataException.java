package com.ververica.bundle_lift.flink.mining.shared.exception;

/**
 * Recoverable data-quality rejection: a context segment or a rule's uplift
 * groups are too small. Callers log the rejected identity and skip it.
 */
public class InsufficientDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String identity;
    private final int observed;
    private final int required;

    public InsufficientDataException(String identity, int observed, int required) {
        super(String.format("Insufficient data for %s: %d < %d", identity, observed, required));
        this.identity = identity;
        this.observed = observed;
        this.required = required;
    }

    public String getIdentity() {
        return identity;
    }

    public int getObserved() {
        return observed;
    }

    public int getRequired() {
        return required;
    }
}
