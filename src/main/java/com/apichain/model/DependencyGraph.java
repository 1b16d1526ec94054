package com.apichain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A dependency graph over operations, stored as index-addressed adjacency lists.
 * <p>
 * Operation indices follow declaration order. Edges are kept sorted by (source, target) so that
 * every traversal over them is deterministic.
 */
public final class DependencyGraph {

    private final List<ApiOperation> operations;
    private final List<DependencyEdge> edges;
    private final List<List<DependencyEdge>> outgoing;
    private final List<List<DependencyEdge>> incoming;
    private final Map<OperationKey, Integer> indexByKey = new HashMap<>();

    public DependencyGraph(List<ApiOperation> operations, List<DependencyEdge> edges) {
        this.operations = List.copyOf(operations);
        List<DependencyEdge> sorted = new ArrayList<>(edges);
        sorted.sort(Comparator.comparingInt(DependencyEdge::source).thenComparingInt(DependencyEdge::target));
        this.edges = Collections.unmodifiableList(sorted);

        this.outgoing = new ArrayList<>(this.operations.size());
        this.incoming = new ArrayList<>(this.operations.size());
        for (int i = 0; i < this.operations.size(); i++) {
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
            indexByKey.put(this.operations.get(i).key(), i);
        }
        for (DependencyEdge edge : this.edges) {
            if (edge.source() < 0 || edge.source() >= size() || edge.target() < 0 || edge.target() >= size()) {
                throw new IllegalArgumentException("Edge refers to an unknown operation index: " + edge);
            }
            outgoing.get(edge.source()).add(edge);
            incoming.get(edge.target()).add(edge);
        }
    }

    public int size() {
        return operations.size();
    }

    public List<ApiOperation> operations() {
        return operations;
    }

    public ApiOperation operation(int index) {
        return operations.get(index);
    }

    public OperationKey key(int index) {
        return operations.get(index).key();
    }

    public int indexOf(OperationKey key) {
        Integer index = indexByKey.get(key);
        return index == null ? -1 : index;
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public List<DependencyEdge> outgoing(int index) {
        return Collections.unmodifiableList(outgoing.get(index));
    }

    public List<DependencyEdge> incoming(int index) {
        return Collections.unmodifiableList(incoming.get(index));
    }

    public Optional<DependencyEdge> edge(int source, int target) {
        return outgoing.get(source).stream().filter(e -> e.target() == target).findFirst();
    }

    public boolean hasEdge(int source, int target) {
        return edge(source, target).isPresent();
    }

    /**
     * @return {@code true} if {@code to} is reachable from {@code from} by following edges forward.
     */
    public boolean reachable(int from, int to) {
        boolean[] seen = new boolean[size()];
        List<Integer> stack = new ArrayList<>();
        stack.add(from);
        while (!stack.isEmpty()) {
            int current = stack.remove(stack.size() - 1);
            if (current == to) {
                return true;
            }
            if (seen[current]) {
                continue;
            }
            seen[current] = true;
            outgoing.get(current).forEach(e -> stack.add(e.target()));
        }
        return false;
    }

    public OperationDependency toDependency(DependencyEdge edge) {
        return new OperationDependency(key(edge.source()), key(edge.target()), edge.reason(), edge.mappings());
    }

    public List<OperationDependency> toDependencies() {
        return edges.stream().map(this::toDependency).toList();
    }
}
