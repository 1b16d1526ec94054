package com.apichain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The record of executing one operation of a sequence.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
@NoArgsConstructor
public class ExecutionStep {

    /**
     * Zero-based position of the step within its sequence.
     */
    private int index;

    private OperationKey operation;

    private StepStatus status = StepStatus.PENDING;

    /**
     * Values substituted into the path template, keyed by parameter name.
     */
    private Map<String, Object> pathValues = new LinkedHashMap<>();

    private Map<String, Object> queryValues = new LinkedHashMap<>();

    private Object body;

    private HttpRequestRecord request;

    /**
     * The response received; {@code null} if the request was never sent or no response arrived.
     */
    private HttpResponseRecord response;

    private long elapsedMs;

    private FailureReason failureReason;

    private String message;

    public ExecutionStep(int index, OperationKey operation) {
        this.index = index;
        this.operation = operation;
    }

    /**
     * Moves the step to {@code next}.
     *
     * @throws IllegalStateException if the state machine does not allow the transition.
     */
    public void transitionTo(StepStatus next) {
        if (!status.successors().contains(next)) {
            throw new IllegalStateException("Step " + index + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public void fail(FailureReason reason, String message) {
        transitionTo(StepStatus.FAILED);
        this.failureReason = reason;
        this.message = message;
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return status == StepStatus.SUCCEEDED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }
}
