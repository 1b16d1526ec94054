package com.apichain.service.impl;

import com.apichain.TestOperations;
import com.apichain.model.ApiMethod;
import com.apichain.model.ApiSpecification;
import com.apichain.model.ExecutionOptions;
import com.apichain.model.ExecutionStep;
import com.apichain.model.FailurePolicy;
import com.apichain.model.FailureReason;
import com.apichain.model.OperationKey;
import com.apichain.model.OperationSequence;
import com.apichain.model.SequenceExecutionResult;
import com.apichain.model.SequenceStatus;
import com.apichain.model.StepStatus;
import com.apichain.service.api.ParameterCertaintyResolver;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SequenceRunnerImplTest {

    private static final OperationKey LIST_ITEMS = new OperationKey(ApiMethod.GET, "/items");
    private static final OperationKey CREATE_ITEM = new OperationKey(ApiMethod.POST, "/items");
    private static final OperationKey GET_ITEM = new OperationKey(ApiMethod.GET, "/items/{itemId}");
    private static final OperationKey LIST_REVIEWS = new OperationKey(ApiMethod.GET, "/items/{itemId}/reviews");

    private MockWebServer mockWebServer;
    private ApiSpecification spec;
    private SequenceRunnerImpl runner;
    private String baseUrl;

    @Mock
    private ParameterCertaintyResolver unusedResolver;

    @BeforeEach
    void setUp() throws Exception {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        baseUrl = mockWebServer.url("/api/v1").toString();
        spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());
        runner = new SequenceRunnerImpl(WebClient.builder().build(), new ParameterCertaintyResolverImpl());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private static OperationSequence sequence(String id, OperationKey... operations) {
        OperationSequence sequence = new OperationSequence();
        sequence.setId(id);
        sequence.setName(id);
        sequence.setOperations(List.of(operations));
        return sequence;
    }

    private ExecutionOptions.ExecutionOptionsBuilder options() {
        return ExecutionOptions.builder().baseUrl(baseUrl).credential("my-secret-key");
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse().setResponseCode(status).setBody(body).addHeader("Content-Type", "application/json");
    }

    @Test
    void run_shouldBindCreatedIdIntoNextPath() throws Exception {
        mockWebServer.enqueue(json(201, "{\"id\":7}"));
        mockWebServer.enqueue(json(200, "{\"id\":7,\"name\":\"hammer\"}"));

        SequenceExecutionResult result = runner.run(sequence("s1", CREATE_ITEM, GET_ITEM), spec, options().build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.COMPLETED);
        assertThat(result.getSteps()).extracting(ExecutionStep::getStatus)
                .containsExactly(StepStatus.SUCCEEDED, StepStatus.SUCCEEDED);

        RecordedRequest create = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(create.getMethod()).isEqualTo("POST");
        assertThat(create.getPath()).isEqualTo("/api/v1/items");
        assertThat(create.getBody().readUtf8()).contains("\"name\":\"default\"");

        RecordedRequest fetch = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(fetch.getMethod()).isEqualTo("GET");
        assertThat(fetch.getPath()).isEqualTo("/api/v1/items/7");
        assertThat(fetch.getHeader("X-API-KEY")).isEqualTo("my-secret-key");

        ExecutionStep second = result.getSteps().get(1);
        assertThat(second.getPathValues()).containsEntry("itemId", 7L);
        assertThat(second.getQueryValues()).doesNotContainKey("itemId");
        assertThat(result.getBindings()).containsEntry("name", "hammer");
    }

    @Test
    void run_shouldContinueAfterTimeoutAndReportPartial() throws Exception {
        mockWebServer.enqueue(json(200, "[]").setHeadersDelay(1, TimeUnit.SECONDS));
        mockWebServer.enqueue(json(201, "{\"id\":1}"));

        SequenceExecutionResult result = runner.run(sequence("s2", LIST_ITEMS, CREATE_ITEM), spec,
                options().timeout(Duration.ofMillis(200)).build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.PARTIAL);
        assertThat(result.getSteps()).hasSize(2);
        assertThat(result.getSteps().get(0).getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(result.getSteps().get(0).getFailureReason()).isEqualTo(FailureReason.TIMEOUT);
        assertThat(result.getSteps().get(1).getStatus()).isEqualTo(StepStatus.SUCCEEDED);
    }

    @Test
    void run_shouldStopAtFirstFailureUnderAbortPolicy() {
        mockWebServer.enqueue(json(500, "{\"code\":500}"));

        SequenceExecutionResult result = runner.run(sequence("s3", LIST_ITEMS, CREATE_ITEM), spec,
                options().failurePolicy(FailurePolicy.ABORT_ON_FAILURE).build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.ABORTED);
        assertThat(result.getSteps()).hasSize(1);
        assertThat(result.getSteps().get(0).getFailureReason()).isEqualTo(FailureReason.UNEXPECTED_STATUS);
        assertThat(result.getAbortReason()).contains("GET /items");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void run_shouldHonourExpectedStatusOverride() {
        mockWebServer.enqueue(json(404, "{\"code\":404}"));

        SequenceExecutionResult result = runner.run(sequence("s4", LIST_ITEMS), spec,
                options().expectedStatus("GET /items", "404").build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.COMPLETED);
        assertThat(result.getSteps().get(0).getResponse().statusCode()).isEqualTo(404);
    }

    @Test
    void run_shouldFailStepWithoutSendingWhenPathParameterIsUnresolved() {
        SequenceExecutionResult result = runner.run(sequence("s5", LIST_REVIEWS), spec, options().build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.PARTIAL);
        ExecutionStep step = result.getSteps().get(0);
        assertThat(step.getFailureReason()).isEqualTo(FailureReason.UNRESOLVED_PARAMETER);
        assertThat(step.getResponse()).isNull();
        assertThat(mockWebServer.getRequestCount()).isZero();
    }

    @Test
    void run_shouldBindJsonPathExtractionsAndSeeds() throws Exception {
        mockWebServer.enqueue(json(201, "{\"id\":3,\"meta\":{\"links\":[{\"href\":\"/items/3\"}]}}"));
        mockWebServer.enqueue(json(200, "{\"id\":3}"));

        SequenceExecutionResult result = runner.run(sequence("s6", CREATE_ITEM, GET_ITEM), spec, options()
                .extraction("link", "$.meta.links[0].href")
                .seedBinding("tenant", "acme")
                .build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.COMPLETED);
        assertThat(result.getBindings())
                .containsEntry("link", "/items/3")
                .containsEntry("tenant", "acme")
                .containsEntry("id", 3L);
    }

    @Test
    void run_shouldTreatMalformedJsonAsTransportError() {
        mockWebServer.enqueue(json(200, "{not json"));

        SequenceExecutionResult result = runner.run(sequence("s7", LIST_ITEMS), spec, options().build());

        assertThat(result.getSteps().get(0).getFailureReason()).isEqualTo(FailureReason.TRANSPORT_ERROR);
        assertThat(result.getStatus()).isEqualTo(SequenceStatus.PARTIAL);
    }

    @Test
    void run_shouldAbortBeforeAnyStepForInvalidConfiguration() {
        SequenceRunnerImpl isolated = new SequenceRunnerImpl(WebClient.builder().build(), unusedResolver);

        SequenceExecutionResult badUrl = isolated.run(sequence("s8", LIST_ITEMS), spec,
                options().baseUrl("localhost:8080").build());
        SequenceExecutionResult noCredential = isolated.run(sequence("s9", GET_ITEM), spec,
                options().credential(null).build());
        SequenceExecutionResult unknownOperation = isolated.run(
                sequence("s10", new OperationKey(ApiMethod.PATCH, "/nothing")), spec, options().build());
        SequenceExecutionResult badStatus = isolated.run(sequence("s11", LIST_ITEMS), spec,
                options().expectedStatus("GET /items", "ok").build());

        for (SequenceExecutionResult result : List.of(badUrl, noCredential, unknownOperation, badStatus)) {
            assertThat(result.getStatus()).isEqualTo(SequenceStatus.ABORTED);
            assertThat(result.getSteps()).isEmpty();
            assertThat(result.getAbortReason()).isNotBlank();
        }
        assertThat(noCredential.getAbortReason()).contains("credential");
        assertThat(mockWebServer.getRequestCount()).isZero();
        verifyNoInteractions(unusedResolver);
    }

    @Test
    void run_shouldNotStartStepsOnceCancelled() {
        SequenceRunnerImpl isolated = new SequenceRunnerImpl(WebClient.builder().build(), unusedResolver);
        ExecutionOptions options = options().build();
        options.getCancellation().cancel();

        SequenceExecutionResult result = isolated.run(sequence("s12", LIST_ITEMS, CREATE_ITEM), spec, options);

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.ABORTED);
        assertThat(result.getSteps()).isEmpty();
        assertThat(result.getAbortReason()).startsWith("Cancelled");
        verifyNoInteractions(unusedResolver);
    }

    @Test
    void run_shouldEncodeBracesInHarvestedQueryValues() throws Exception {
        mockWebServer.enqueue(json(201, "{\"id\":1,\"limit\":\"a{b}c\"}"));
        mockWebServer.enqueue(json(200, "[]"));

        SequenceExecutionResult result = runner.run(sequence("s13", CREATE_ITEM, LIST_ITEMS), spec, options().build());

        assertThat(result.getStatus()).isEqualTo(SequenceStatus.COMPLETED);
        assertThat(result.getSteps().get(1).getQueryValues()).containsEntry("limit", "a{b}c");
        mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        RecordedRequest list = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(list.getPath()).isEqualTo("/api/v1/items?limit=a%7Bb%7Dc");
    }

    @Test
    void buildUri_shouldKeepPathAndQueryValuesLiteral() {
        LinkedMultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        query.add("filter", "{name}");
        query.add("tag", "x y");
        query.add("tag", "{0}");

        URI uri = SequenceRunnerImpl.buildUri("http://localhost:8080/api", "/items/{itemId}",
                Map.of("itemId", "a{b}"), query);

        assertThat(uri.toString())
                .isEqualTo("http://localhost:8080/api/items/a%7Bb%7D?filter=%7Bname%7D&tag=x%20y&tag=%7B0%7D");
    }

    @Test
    void runAndRunAll_shouldResolveCertaintyOncePerCall() {
        mockWebServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return json("POST".equals(request.getMethod()) ? 201 : 200, "{\"id\":5}");
            }
        });
        ParameterCertaintyResolver resolver = spy(new ParameterCertaintyResolverImpl());
        SequenceRunnerImpl counting = new SequenceRunnerImpl(WebClient.builder().build(), resolver);

        counting.run(sequence("s14", CREATE_ITEM, GET_ITEM, LIST_REVIEWS), spec, options().build());
        verify(resolver, times(1)).resolveAll(spec);

        List<SequenceExecutionResult> results = counting.runAll(
                List.of(sequence("s15", CREATE_ITEM, GET_ITEM), sequence("s16", CREATE_ITEM, GET_ITEM)),
                spec, options().maxConcurrentSequences(2).build());

        assertThat(results).extracting(SequenceExecutionResult::getStatus)
                .containsExactly(SequenceStatus.COMPLETED, SequenceStatus.COMPLETED);
        verify(resolver, times(2)).resolveAll(spec);
    }

    @Test
    void runAll_shouldKeepBindingsOfConcurrentRunsApart() {
        mockWebServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("POST".equals(request.getMethod())) {
                    return json(201, "{\"id\":42}");
                }
                return json(200, "{\"id\":42}");
            }
        });
        OperationSequence producing = sequence("a", CREATE_ITEM, GET_ITEM);
        OperationSequence consuming = sequence("b", GET_ITEM);

        List<SequenceExecutionResult> results = runner.runAll(List.of(producing, consuming), spec,
                options().maxConcurrentSequences(2).build());

        assertThat(results).extracting(SequenceExecutionResult::getSequenceId).containsExactly("a", "b");
        assertThat(results.get(0).getStatus()).isEqualTo(SequenceStatus.COMPLETED);
        assertThat(results.get(1).getStatus()).isEqualTo(SequenceStatus.PARTIAL);
        assertThat(results.get(1).getSteps().get(0).getFailureReason()).isEqualTo(FailureReason.UNRESOLVED_PARAMETER);
    }
}
