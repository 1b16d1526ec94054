package com.apichain.service.api;

import com.apichain.model.DependencyGraph;
import com.apichain.model.SequenceGenerationResult;
import com.apichain.model.SequenceStrategy;

/**
 * Orders operations into executable sequences that respect a dependency graph.
 */
public interface SequenceGenerator {

    /**
     * Always completes, even on cyclic graphs; dependencies the result cannot satisfy are reported
     * in {@link SequenceGenerationResult#warnings()}.
     */
    SequenceGenerationResult generate(DependencyGraph graph, SequenceStrategy strategy);
}
