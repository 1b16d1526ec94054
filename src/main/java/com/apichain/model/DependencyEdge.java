package com.apichain.model;

import java.util.List;

/**
 * A directed edge of a {@link DependencyGraph}, addressed by operation index.
 *
 * @param source   index of the producing operation.
 * @param target   index of the operation that consumes the producer's output.
 * @param mappings the attribute pairs that couple the two operations; never empty.
 * @param reason   a short human-readable explanation of why the edge exists.
 */
public record DependencyEdge(int source, int target, List<AttributeMapping> mappings, String reason) {

    public DependencyEdge {
        mappings = List.copyOf(mappings);
    }

    /**
     * The number of attributes shared by the two operations.
     */
    public int weight() {
        return mappings.size();
    }
}
