package com.agentfleet.concurrency;

/**
 * How task execution time is estimated before admission.
 */
public enum EstimatorMode {
    /** Fixed table keyed by task type. */
    STATIC,
    /** History-weighted blend of observed durations and the static table. */
    ADAPTIVE,
    /** Estimate supplied by an external estimator; a conservative constant when none is given. */
    EXTERNAL
}
