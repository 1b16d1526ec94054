package com.apichain.service.impl;

import com.apichain.model.ApiMethod;
import com.apichain.model.AttributeMapping;
import com.apichain.model.DependencyEdge;
import com.apichain.model.DependencyGraph;
import com.apichain.model.OperationKey;
import com.apichain.model.OperationSequence;
import com.apichain.model.SequenceGenerationResult;
import com.apichain.model.SequenceStrategy;
import com.apichain.model.UnresolvedDependency;
import com.apichain.service.api.SequenceGenerator;
import com.apichain.service.support.AttributeMatcher;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Builds sequences from a dependency graph. All bookkeeping lives in per-call state, so one instance
 * can serve concurrent calls for different specifications.
 */
@Service
@Slf4j
public class SequenceGeneratorImpl implements SequenceGenerator {

    private final int maxDepth;

    public SequenceGeneratorImpl(@Value("${sequence.max-depth:5}") int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public SequenceGenerationResult generate(DependencyGraph graph, SequenceStrategy strategy) {
        List<OperationSequence> sequences = new ArrayList<>();
        List<UnresolvedDependency> warnings = new ArrayList<>();
        if (strategy == SequenceStrategy.GREEDY) {
            sequences.add(greedy(graph, warnings));
        } else {
            for (int head = 0; head < graph.size(); head++) {
                sequences.add(chain(graph, head, warnings));
            }
        }
        log.info("Generated {} {} sequence(s) over {} operations with {} unresolved dependencies.",
                sequences.size(), strategy, graph.size(), warnings.size());
        return new SequenceGenerationResult(sequences, warnings);
    }

    /**
     * Takes edges lightest first, ties in (source, target) order, and schedules both endpoints of every
     * edge whose endpoints are still unvisited. Operations no such edge reaches follow in declaration order.
     */
    private OperationSequence greedy(DependencyGraph graph, List<UnresolvedDependency> warnings) {
        List<DependencyEdge> byWeight = new ArrayList<>(graph.edges());
        byWeight.sort(Comparator.comparingInt(DependencyEdge::weight)
                .thenComparingInt(DependencyEdge::source)
                .thenComparingInt(DependencyEdge::target));

        boolean[] visited = new boolean[graph.size()];
        List<Integer> order = new ArrayList<>();
        for (DependencyEdge edge : byWeight) {
            if (visited[edge.source()] || visited[edge.target()]) {
                continue;
            }
            visited[edge.source()] = true;
            visited[edge.target()] = true;
            order.add(edge.source());
            order.add(edge.target());
        }
        for (int i = 0; i < graph.size(); i++) {
            if (!visited[i]) {
                order.add(i);
            }
        }

        OperationSequence sequence = newSequence(graph, order, SequenceStrategy.GREEDY, null);
        sequence.setName("global order");
        sequence.setDescription("Runs all " + order.size() + " operations in one order, tightly coupled pairs first.");
        List<UnresolvedDependency> unresolved = orderingViolations(graph, order, sequence.getId());
        record(sequence, unresolved, warnings);
        return sequence;
    }

    /**
     * Depth-first over incoming edges of {@code head}, placing each producer before its consumer. A producer is
     * pulled in only if it feeds an attribute that the producers already chosen for the same consumer do not.
     */
    private OperationSequence chain(DependencyGraph graph, int head, List<UnresolvedDependency> warnings) {
        ChainState state = new ChainState();
        visit(graph, head, 0, state);

        OperationKey headKey = graph.key(head);
        OperationSequence sequence = newSequence(graph, state.order, SequenceStrategy.CHAIN, headKey);
        sequence.setName("chain " + headKey.signature());
        sequence.setDescription(state.order.size() == 1
                ? "Runs " + headKey.signature() + " on its own."
                : "Runs " + (state.order.size() - 1) + " producer(s) before " + headKey.signature() + ".");

        List<UnresolvedDependency> unresolved = new ArrayList<>();
        state.depthLimited.forEach(edge -> unresolved.add(new UnresolvedDependency(
                graph.key(edge.target()), graph.key(edge.source()), UnresolvedDependency.Kind.DEPTH_LIMIT, sequence.getId())));
        unresolved.addAll(orderingViolations(graph, state.order, sequence.getId()));
        record(sequence, unresolved, warnings);
        return sequence;
    }

    private void visit(DependencyGraph graph, int node, int depth, ChainState state) {
        state.onPath.add(node);
        Set<String> covered = new HashSet<>();
        for (DependencyEdge edge : rankedIncoming(graph, node)) {
            int producer = edge.source();
            Set<String> feeds = edge.mappings().stream().map(AttributeMapping::targetAttribute).collect(Collectors.toSet());
            if (state.placed.contains(producer)) {
                covered.addAll(feeds);
                continue;
            }
            feeds.removeAll(covered);
            if (feeds.isEmpty() || state.onPath.contains(producer)) {
                // an on-path producer closes a cycle; it is reported once the order is known
                continue;
            }
            if (depth + 1 > maxDepth) {
                state.depthLimited.add(edge);
                continue;
            }
            visit(graph, producer, depth + 1, state);
            covered.addAll(feeds);
        }
        state.onPath.remove(node);
        state.placed.add(node);
        state.order.add(node);
    }

    /**
     * Creators first, then by method precedence, then the producer whose path is closest, then declaration order.
     */
    private List<DependencyEdge> rankedIncoming(DependencyGraph graph, int node) {
        String path = graph.operation(node).getPath();
        List<DependencyEdge> ranked = new ArrayList<>(graph.incoming(node));
        ranked.sort(Comparator
                .comparing((DependencyEdge e) -> graph.operation(e.source()).getMethod() != ApiMethod.POST)
                .thenComparingInt(e -> graph.operation(e.source()).getMethod().precedence())
                .thenComparingInt(e -> -AttributeMatcher.commonPrefixLength(graph.operation(e.source()).getPath(), path))
                .thenComparingInt(DependencyEdge::source));
        return ranked;
    }

    /**
     * Every edge between two scheduled operations whose producer comes after its consumer.
     */
    private List<UnresolvedDependency> orderingViolations(DependencyGraph graph, List<Integer> order, String sequenceId) {
        int[] position = new int[graph.size()];
        Arrays.fill(position, -1);
        for (int i = 0; i < order.size(); i++) {
            position[order.get(i)] = i;
        }
        List<UnresolvedDependency> violations = new ArrayList<>();
        for (DependencyEdge edge : graph.edges()) {
            int source = position[edge.source()];
            int target = position[edge.target()];
            if (source >= 0 && target >= 0 && source > target) {
                UnresolvedDependency.Kind kind = graph.reachable(edge.target(), edge.source())
                        ? UnresolvedDependency.Kind.CYCLE
                        : UnresolvedDependency.Kind.OUT_OF_ORDER;
                violations.add(new UnresolvedDependency(graph.key(edge.target()), graph.key(edge.source()), kind, sequenceId));
            }
        }
        return violations;
    }

    private OperationSequence newSequence(DependencyGraph graph, List<Integer> order, SequenceStrategy strategy, OperationKey head) {
        List<OperationKey> keys = order.stream().map(graph::key).toList();
        String identity = strategy + ":" + (head == null ? "" : head.signature()) + ":"
                + keys.stream().map(OperationKey::signature).collect(Collectors.joining(","));

        OperationSequence sequence = new OperationSequence();
        sequence.setId(UUID.nameUUIDFromBytes(identity.getBytes(StandardCharsets.UTF_8)).toString());
        sequence.setStrategy(strategy);
        sequence.setHead(head);
        sequence.setOperations(new ArrayList<>(keys));

        for (int i = 0; i < order.size(); i++) {
            for (int j = i + 1; j < order.size(); j++) {
                graph.edge(order.get(i), order.get(j)).map(graph::toDependency).ifPresent(sequence.getDependencies()::add);
            }
        }
        log.debug("  Sequence {} ({} operations, {} satisfied dependencies)", sequence.getId(), order.size(),
                sequence.getDependencies().size());
        return sequence;
    }

    private void record(OperationSequence sequence, List<UnresolvedDependency> unresolved, List<UnresolvedDependency> warnings) {
        unresolved.forEach(u -> {
            log.warn("Sequence {}: {}", sequence.getName(), u.describe());
            sequence.getWarnings().add(u.describe());
        });
        warnings.addAll(unresolved);
    }

    private static final class ChainState {
        private final List<Integer> order = new ArrayList<>();
        private final Set<Integer> placed = new HashSet<>();
        private final Set<Integer> onPath = new HashSet<>();
        private final List<DependencyEdge> depthLimited = new ArrayList<>();
    }
}
