package com.apichain.model;

/**
 * The schema feature that made a parameter certain, or {@link #NONE} for uncertain parameters.
 */
public enum CertaintyBasis {
    ENUM,
    FORMAT,
    PATTERN,
    BOUNDED_RANGE,
    DESCRIPTION_HINT,
    NAME_PATTERN,
    NONE
}
