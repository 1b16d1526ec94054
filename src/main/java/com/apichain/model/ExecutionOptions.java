package com.apichain.model;

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Caller-supplied settings for running sequences.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionOptions {

    /**
     * The server to run against. When {@code null}, the specification's first server URL is used.
     */
    String baseUrl;

    /**
     * The static credential applied according to each operation's security requirement.
     */
    String credential;

    /**
     * Values placed in every run's binding table before the first step.
     */
    @Singular
    Map<String, Object> seedBindings;

    @Builder.Default
    FailurePolicy failurePolicy = FailurePolicy.CONTINUE;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(5);

    @Builder.Default
    int maxConcurrentSequences = 4;

    /**
     * Expected status specs ("2xx", "404", "200-299") keyed by operation signature. Unlisted operations expect 2xx.
     */
    @Singular
    Map<String, String> expectedStatuses;

    /**
     * Request body test data keyed by operation signature, overlaid on the generated body.
     */
    @Singular
    Map<String, Map<String, Object>> requestBodies;

    /**
     * JsonPath expressions keyed by the attribute name their result is bound to.
     */
    @Singular
    Map<String, String> extractions;

    @Builder.Default
    CancellationToken cancellation = new CancellationToken();
}
