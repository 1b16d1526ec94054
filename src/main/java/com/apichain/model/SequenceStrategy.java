package com.apichain.model;

public enum SequenceStrategy {
    /** One chain per operation: the operation preceded by the producers it needs. */
    CHAIN,
    /** One global order built by repeatedly taking the lightest edge between unvisited operations. */
    GREEDY
}
