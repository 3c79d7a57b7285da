package com.findstaffing.api.step;

public enum Criticality {
    /** Failure aborts the remaining steps and fails the request. */
    CRITICAL,
    /** Failure is logged and recorded; later steps still run. */
    BEST_EFFORT
}
