package com.apichain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * An ordered chain of operations meant to be executed together, so that earlier steps supply the data
 * later steps consume.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class OperationSequence {

    /**
     * A name-based UUID, stable across runs for the same specification and strategy.
     */
    private String id;

    private String name;

    private String description;

    private SequenceStrategy strategy;

    /**
     * The operation under test for {@link SequenceStrategy#CHAIN} sequences; {@code null} for a global order.
     */
    private OperationKey head;

    private List<OperationKey> operations = new ArrayList<>();

    /**
     * The dependencies satisfied by this order, i.e. edges whose producer runs before its consumer.
     */
    private List<OperationDependency> dependencies = new ArrayList<>();

    /**
     * Human-readable notes about dependencies this order leaves unsatisfied.
     */
    private List<String> warnings = new ArrayList<>();
}
