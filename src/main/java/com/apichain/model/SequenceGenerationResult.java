package com.apichain.model;

import java.util.List;

/**
 * Generated sequences together with every dependency they leave unsatisfied.
 */
public record SequenceGenerationResult(List<OperationSequence> sequences, List<UnresolvedDependency> warnings) {

    public SequenceGenerationResult {
        sequences = List.copyOf(sequences);
        warnings = List.copyOf(warnings);
    }
}
