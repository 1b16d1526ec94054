package com.apichain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The lifecycle of one {@link ExecutionStep}: {@code PENDING -> BUILDING_REQUEST -> SENT -> SUCCEEDED | FAILED}.
 * A step may also fail straight from {@code BUILDING_REQUEST} when a path parameter has no value.
 */
public enum StepStatus {
    PENDING,
    BUILDING_REQUEST,
    SENT,
    SUCCEEDED,
    FAILED;

    public Set<StepStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(BUILDING_REQUEST);
            case BUILDING_REQUEST -> EnumSet.of(SENT, FAILED);
            case SENT -> EnumSet.of(SUCCEEDED, FAILED);
            case SUCCEEDED, FAILED -> EnumSet.noneOf(StepStatus.class);
        };
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
