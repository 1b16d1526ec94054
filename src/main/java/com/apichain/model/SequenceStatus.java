package com.apichain.model;

public enum SequenceStatus {
    /** Every step succeeded. */
    COMPLETED,
    /** At least one step failed and the remaining steps still ran. */
    PARTIAL,
    /** The run stopped early: configuration error, cancellation, or a failure under abort-on-failure. */
    ABORTED
}
