package com.apichain.model;

public enum FailurePolicy {
    /** Keep executing after a failed step; the run ends {@link SequenceStatus#PARTIAL}. */
    CONTINUE,
    /** Stop at the first failed step; the run ends {@link SequenceStatus#ABORTED}. */
    ABORT_ON_FAILURE
}
