package com.apichain.model;

/**
 * A dependency left unsatisfied by a generated sequence: {@code dependent} runs without
 * {@code producer} having run before it.
 */
public record UnresolvedDependency(OperationKey dependent, OperationKey producer, Kind kind, String sequenceId) {

    public enum Kind {
        /** The producer itself depends, directly or transitively, on the dependent. */
        CYCLE,
        /** The producer lies deeper than the configured traversal depth. */
        DEPTH_LIMIT,
        /** The global order placed the producer after the dependent. */
        OUT_OF_ORDER
    }

    public String describe() {
        return switch (kind) {
            case CYCLE -> dependent + " runs before its producer " + producer + " (dependency cycle)";
            case DEPTH_LIMIT -> "Producer " + producer + " of " + dependent + " is beyond the chain depth limit";
            case OUT_OF_ORDER -> dependent + " is scheduled before its producer " + producer;
        };
    }
}
