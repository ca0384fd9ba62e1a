package com.ververica.bundle_lift.flink.mining.store;

/**
 * Persistence failure of a rule store. Reported to the run's caller as its
 * own failure kind, apart from data-quality skips and context failures.
 */
public class RuleStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RuleStoreException(String message) {
        super(message);
    }

    public RuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
