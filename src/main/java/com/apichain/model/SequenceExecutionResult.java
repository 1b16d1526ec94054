package com.apichain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The outcome of one sequence run. Created fresh for every run.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@NoArgsConstructor
public class SequenceExecutionResult {

    private String sequenceId;

    private String baseUrl;

    private SequenceStatus status;

    private List<ExecutionStep> steps = new ArrayList<>();

    /**
     * The value-binding table as it stood when the run ended.
     */
    private Map<String, Object> bindings = new LinkedHashMap<>();

    /**
     * Why the run was aborted; {@code null} unless {@link #status} is {@link SequenceStatus#ABORTED}.
     */
    private String abortReason;

    private Instant startedAt;

    private long elapsedMs;

    public SequenceExecutionResult(String sequenceId, String baseUrl) {
        this.sequenceId = sequenceId;
        this.baseUrl = baseUrl;
        this.startedAt = Instant.now();
    }

    public void abort(String reason) {
        this.status = SequenceStatus.ABORTED;
        this.abortReason = reason;
    }
}
