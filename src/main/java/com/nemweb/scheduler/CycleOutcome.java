package com.nemweb.scheduler;

/**
 * Result of one fetch/parse/update cycle.
 */
public enum CycleOutcome {
    /** A new series was committed to the store. */
    UPDATED,
    /** The latest published bundle was already processed. */
    UNCHANGED,
    /** Nothing was published for the product this cycle. */
    NO_DATA,
    /** Fetch or decode failed; counts towards staleness. */
    FAILED,
    /** The poller was stopped while the cycle ran; nothing was committed. */
    CANCELLED
}
