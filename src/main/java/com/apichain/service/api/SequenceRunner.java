package com.apichain.service.api;

import com.apichain.model.ApiSpecification;
import com.apichain.model.ExecutionOptions;
import com.apichain.model.OperationSequence;
import com.apichain.model.SequenceExecutionResult;
import java.util.List;

/**
 * Executes operation sequences against a live server, feeding values from earlier responses into later requests.
 */
public interface SequenceRunner {

    /**
     * Runs one sequence. Never throws: configuration problems yield an
     * {@link com.apichain.model.SequenceStatus#ABORTED ABORTED} result with no steps.
     */
    SequenceExecutionResult run(OperationSequence sequence, ApiSpecification spec, ExecutionOptions options);

    /**
     * Runs independent sequences concurrently, at most {@link ExecutionOptions#getMaxConcurrentSequences()}
     * at a time. Results are returned in the order of {@code sequences}.
     */
    List<SequenceExecutionResult> runAll(List<OperationSequence> sequences, ApiSpecification spec, ExecutionOptions options);
}
