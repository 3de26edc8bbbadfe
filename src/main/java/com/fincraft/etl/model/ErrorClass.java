package com.fincraft.etl.model;

/**
 * Error taxonomy surfaced to operators and pass reports.
 */
public enum ErrorClass {
    /** Payload carried no business data. Not a failure. */
    EMPTY_UPSTREAM,
    /** Timeout, rate-limit response or transport problem. Counted toward the failure ceiling. */
    TRANSIENT_FETCH,
    /** Payload failed structural validation. Counted like a transient error. */
    PERMANENT_VALIDATION,
    /** Entity reached the failure ceiling and waits for an operator reset. */
    CIRCUIT_OPEN
}
