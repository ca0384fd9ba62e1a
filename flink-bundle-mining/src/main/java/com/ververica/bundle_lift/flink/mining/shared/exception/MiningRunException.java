package com.ververica.bundle_lift.flink.mining.shared.exception;

/**
 * A mining run failed: a context's computation kept failing after its
 * retry budget, or the execution environment gave up. Nothing from the
 * failed run is persisted.
 */
public class MiningRunException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MiningRunException(String message) {
        super(message);
    }

    public MiningRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
