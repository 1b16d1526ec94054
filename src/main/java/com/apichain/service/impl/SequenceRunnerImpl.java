package com.apichain.service.impl;

import com.apichain.exception.InvalidExecutionConfigurationException;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.ExecutionOptions;
import com.apichain.model.ExecutionStep;
import com.apichain.model.FailurePolicy;
import com.apichain.model.FailureReason;
import com.apichain.model.HttpRequestRecord;
import com.apichain.model.HttpResponseRecord;
import com.apichain.model.OperationKey;
import com.apichain.model.OperationSequence;
import com.apichain.model.ParameterCertainty;
import com.apichain.model.SequenceExecutionResult;
import com.apichain.model.SequenceStatus;
import com.apichain.model.StepStatus;
import com.apichain.service.api.ParameterCertaintyResolver;
import com.apichain.service.api.SequenceRunner;
import com.apichain.service.support.CredentialApplier;
import com.apichain.service.support.ExpectedStatus;
import com.apichain.service.support.RequestBinder;
import com.apichain.service.support.ResponseHarvester;
import com.apichain.service.support.SchemaResolver;
import com.apichain.service.support.ValueBindingTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs sequences step by step over a shared {@link WebClient}. Each run owns its value-binding table,
 * so concurrent runs never see each other's values.
 */
@Service
@Slf4j
public class SequenceRunnerImpl implements SequenceRunner {

    private static final String QUERY_VARIABLE_PREFIX = "query.";

    private final WebClient webClient;
    private final ParameterCertaintyResolver certaintyResolver;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SequenceRunnerImpl(WebClient webClient, ParameterCertaintyResolver certaintyResolver) {
        this.webClient = webClient;
        this.certaintyResolver = certaintyResolver;
    }

    @Override
    public SequenceExecutionResult run(OperationSequence sequence, ApiSpecification spec, ExecutionOptions options) {
        return execute(sequence, spec, options, null);
    }

    /**
     * @param certainty path-parameter certainty for the whole specification, or {@code null} to resolve it
     *                  once the first step is about to be built.
     */
    private SequenceExecutionResult execute(OperationSequence sequence,
                                            ApiSpecification spec,
                                            ExecutionOptions options,
                                            Map<OperationKey, Map<String, ParameterCertainty>> certainty) {
        long start = System.currentTimeMillis();
        String baseUrl = options.getBaseUrl() != null ? options.getBaseUrl()
                : spec.getServerUrls().isEmpty() ? null : spec.getServerUrls().get(0);
        SequenceExecutionResult result = new SequenceExecutionResult(sequence.getId(), baseUrl);

        List<ApiOperation> operations;
        try {
            operations = validate(sequence, spec, options, baseUrl);
        } catch (InvalidExecutionConfigurationException e) {
            log.error("Sequence {} aborted before its first step: {}", sequence.getName(), e.getMessage());
            result.abort(e.getMessage());
            result.setElapsedMs(System.currentTimeMillis() - start);
            return result;
        }

        log.info("Running sequence '{}' ({} steps) against {}", sequence.getName(), operations.size(), baseUrl);
        ValueBindingTable table = new ValueBindingTable();
        table.seed(options.getSeedBindings());
        RequestBinder binder = new RequestBinder(SchemaResolver.of(spec));

        boolean anyFailed = false;
        for (int i = 0; i < operations.size(); i++) {
            ApiOperation operation = operations.get(i);
            if (options.getCancellation().isCancelled()) {
                log.info("Sequence '{}' cancelled before step {}", sequence.getName(), i);
                result.abort("Cancelled before step " + i + " (" + operation.signature() + ")");
                break;
            }
            if (certainty == null) {
                certainty = certaintyResolver.resolveAll(spec);
            }
            ExecutionStep step = new ExecutionStep(i, operation.key());
            result.getSteps().add(step);
            log.info("Executing Step {}: {}", i, operation.signature());
            executeStep(step, operation, spec, certainty.getOrDefault(operation.key(), Map.of()), options, baseUrl, binder, table);

            if (step.isFailed()) {
                anyFailed = true;
                log.warn("Step {} ({}) failed: {} {}", i, operation.signature(), step.getFailureReason(), step.getMessage());
                if (options.getFailurePolicy() == FailurePolicy.ABORT_ON_FAILURE) {
                    result.abort("Step " + i + " (" + operation.signature() + ") failed: " + step.getMessage());
                    break;
                }
            } else {
                log.info("Step {} successful.", i);
            }
        }

        if (result.getStatus() == null) {
            result.setStatus(anyFailed ? SequenceStatus.PARTIAL : SequenceStatus.COMPLETED);
        }
        result.setBindings(table.snapshot());
        result.setElapsedMs(System.currentTimeMillis() - start);
        log.info("Sequence '{}' finished {} in {} ms.", sequence.getName(), result.getStatus(), result.getElapsedMs());
        return result;
    }

    @Override
    public List<SequenceExecutionResult> runAll(List<OperationSequence> sequences, ApiSpecification spec, ExecutionOptions options) {
        int concurrency = Math.max(1, options.getMaxConcurrentSequences());
        Map<OperationKey, Map<String, ParameterCertainty>> certainty = sequences.isEmpty() ? Map.of() : certaintyResolver.resolveAll(spec);
        return Flux.fromIterable(sequences)
                .flatMapSequential(sequence -> Mono.fromCallable(() -> execute(sequence, spec, options, certainty))
                        .subscribeOn(Schedulers.boundedElastic()), concurrency)
                .collectList()
                .block();
    }

    private List<ApiOperation> validate(OperationSequence sequence, ApiSpecification spec, ExecutionOptions options, String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidExecutionConfigurationException("No base URL given and the specification declares no server.");
        }
        try {
            URI uri = URI.create(baseUrl);
            if (uri.getScheme() == null || !(uri.getScheme().equals("http") || uri.getScheme().equals("https")) || uri.getHost() == null) {
                throw new InvalidExecutionConfigurationException("Invalid base URL '" + baseUrl + "': an absolute http(s) URL is required.");
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidExecutionConfigurationException("Invalid base URL '" + baseUrl + "': " + e.getMessage());
        }

        List<ApiOperation> operations = new ArrayList<>();
        for (OperationKey key : sequence.getOperations()) {
            ApiOperation operation = spec.findOperation(key).orElseThrow(() ->
                    new InvalidExecutionConfigurationException("Sequence refers to unknown operation " + key));
            if ((options.getCredential() == null || options.getCredential().isBlank())
                    && CredentialApplier.requiresCredential(operation, spec)) {
                throw new InvalidExecutionConfigurationException(
                        "Operation " + key + " requires a credential, but none was supplied.");
            }
            operations.add(operation);
        }
        for (String signature : options.getExpectedStatuses().keySet()) {
            try {
                ExpectedStatus.parse(options.getExpectedStatuses().get(signature));
            } catch (IllegalArgumentException e) {
                throw new InvalidExecutionConfigurationException(e.getMessage() + " for " + signature);
            }
        }
        return operations;
    }

    private void executeStep(ExecutionStep step,
                             ApiOperation operation,
                             ApiSpecification spec,
                             Map<String, ParameterCertainty> certainty,
                             ExecutionOptions options,
                             String baseUrl,
                             RequestBinder binder,
                             ValueBindingTable table) {
        step.transitionTo(StepStatus.BUILDING_REQUEST);
        RequestBinder.BoundRequest bound = binder.bind(operation, certainty, table,
                options.getRequestBodies().get(operation.signature()));
        step.setPathValues(bound.pathValues());
        step.setQueryValues(bound.queryValues());
        step.setBody(bound.body());

        HttpHeaders headers = new HttpHeaders();
        MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();
        bound.queryValues().forEach((name, value) -> queryParams.add(name, String.valueOf(value)));
        CredentialApplier.apply(operation, spec, options.getCredential(), headers, queryParams);

        URI uri;
        try {
            uri = buildUri(baseUrl, operation.getPath(), bound.pathValues(), queryParams);
        } catch (IllegalArgumentException e) {
            step.fail(FailureReason.TRANSPORT_ERROR, "Cannot build request URI: " + e.getMessage());
            return;
        }
        step.setRequest(new HttpRequestRecord(operation.getMethod().name(), uri.toString(), headers.toSingleValueMap(), bound.body()));
        log.debug("  {} {} query={} body={}", operation.getMethod(), uri, bound.queryValues(), bound.body());

        if (!bound.isResolved()) {
            step.fail(FailureReason.UNRESOLVED_PARAMETER, "No value available for path parameter(s) " + bound.unresolved());
            return;
        }

        step.transitionTo(StepStatus.SENT);
        long sentAt = System.currentTimeMillis();
        HttpResponseRecord response;
        try {
            response = send(operation, uri, headers, bound.body(), options);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            step.setElapsedMs(System.currentTimeMillis() - sentAt);
            if (cause instanceof TimeoutException) {
                step.fail(FailureReason.TIMEOUT, "No response within " + options.getTimeout().toMillis() + " ms");
            } else {
                step.fail(FailureReason.TRANSPORT_ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage());
            }
            return;
        }
        step.setElapsedMs(System.currentTimeMillis() - sentAt);
        step.setResponse(response);

        ExpectedStatus expected = ExpectedStatus.parse(options.getExpectedStatuses().get(operation.signature()));
        if (!expected.matches(response.statusCode())) {
            step.fail(FailureReason.UNEXPECTED_STATUS, "Status " + response.statusCode() + " outside expected " + expected);
            return;
        }

        Map<String, Object> harvested = new LinkedHashMap<>();
        if (response.body() != null && !response.body().isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(response.body());
                harvested.putAll(ResponseHarvester.harvest(json));
                harvested.putAll(ResponseHarvester.extract(response.body(), options.getExtractions()));
            } catch (JsonProcessingException e) {
                if (isJson(response.contentType())) {
                    step.fail(FailureReason.TRANSPORT_ERROR, "Malformed JSON response: " + e.getOriginalMessage());
                    return;
                }
                log.debug("  Response of {} is not JSON; nothing harvested", operation.signature());
            }
        }
        harvested.forEach((name, value) -> table.bind(name, value, operation.key()));
        log.debug("  Harvested {}", harvested.keySet());
        step.transitionTo(StepStatus.SUCCEEDED);
    }

    /**
     * Query values go through the template as variables of their own, so a value such as {@code a{b}c}
     * is encoded rather than read as a placeholder.
     */
    static URI buildUri(String baseUrl, String path, Map<String, Object> pathValues, MultiValueMap<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path(path);
        Map<String, Object> variables = new HashMap<>(pathValues);
        int index = 0;
        for (Map.Entry<String, List<String>> parameter : queryParams.entrySet()) {
            for (String value : parameter.getValue()) {
                String variable = QUERY_VARIABLE_PREFIX + index++;
                builder.queryParam(parameter.getKey(), "{" + variable + "}");
                variables.put(variable, value);
            }
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    private HttpResponseRecord send(ApiOperation operation, URI uri, HttpHeaders headers, Object body, ExecutionOptions options) {
        WebClient.RequestBodySpec request = webClient.method(HttpMethod.valueOf(operation.getMethod().name()))
                .uri(uri)
                .headers(h -> h.addAll(headers));
        WebClient.RequestHeadersSpec<?> exchange = body == null
                ? request
                : request.contentType(MediaType.APPLICATION_JSON).bodyValue(body);
        return exchange
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> new HttpResponseRecord(
                                response.statusCode().value(),
                                response.headers().contentType().map(MediaType::toString).orElse(null),
                                text)))
                .timeout(options.getTimeout())
                .block();
    }

    private boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json");
    }
}
