package com.apichain.service.impl;

import com.apichain.TestOperations;
import com.apichain.model.ApiMethod;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.Certainty;
import com.apichain.model.CertaintyBasis;
import com.apichain.model.OperationKey;
import com.apichain.model.ParameterCertainty;
import com.apichain.model.schema.ScalarSchemaNode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.apichain.TestOperations.op;
import static com.apichain.TestOperations.pathParam;
import static org.assertj.core.api.Assertions.assertThat;

class ParameterCertaintyResolverImplTest {

    private static final OperationKey CREATE_ITEM = new OperationKey(ApiMethod.POST, "/items");

    private ParameterCertaintyResolverImpl resolver;

    @BeforeEach
    void setUp() {
        resolver = new ParameterCertaintyResolverImpl();
    }

    private static ApiOperation getItem(ScalarSchemaNode schema, String description) {
        return op(ApiMethod.GET, "/items/{itemId}", Set.of("itemId"), Set.of("name")).toBuilder()
                .parameter(pathParam("itemId", schema, description))
                .build();
    }

    @Test
    void resolve_shouldTreatSmallBoundedRangeAsCertain() {
        ScalarSchemaNode range = new ScalarSchemaNode("integer", null, null, null,
                BigDecimal.ONE, BigDecimal.valueOf(50), null, null);
        ApiOperation operation = getItem(range, null);

        Map<String, ParameterCertainty> result = resolver.resolve(operation, TestOperations.spec(operation));

        assertThat(result.get("itemId").certainty()).isEqualTo(Certainty.CERTAIN);
        assertThat(result.get("itemId").basis()).isEqualTo(CertaintyBasis.BOUNDED_RANGE);
        assertThat(result.get("itemId").dependencyEndpoints()).isEmpty();
    }

    @Test
    void resolve_shouldListProducersForUncertainParameter() {
        ApiOperation create = op(ApiMethod.POST, "/items", Set.of("name"), Set.of("id", "name"));
        ApiOperation operation = getItem(ScalarSchemaNode.ofType("string"), null);

        Map<String, ParameterCertainty> result = resolver.resolve(operation, TestOperations.spec(create, operation));

        ParameterCertainty itemId = result.get("itemId");
        assertThat(itemId.certainty()).isEqualTo(Certainty.UNCERTAIN);
        assertThat(itemId.basis()).isEqualTo(CertaintyBasis.NONE);
        assertThat(itemId.dependencyEndpoints()).containsExactly(CREATE_ITEM);
    }

    @Test
    void resolve_shouldTreatWideRangeAsUncertain() {
        ScalarSchemaNode wide = new ScalarSchemaNode("integer", null, null, null,
                BigDecimal.ONE, BigDecimal.valueOf(1000), null, null);
        ApiOperation operation = getItem(wide, null);

        assertThat(resolver.resolve(operation, TestOperations.spec(operation)).get("itemId").isCertain()).isFalse();
    }

    @Test
    void resolve_shouldUseFormatPatternAndDescriptionHints() {
        ApiOperation byFormat = getItem(new ScalarSchemaNode("string", "uuid", null, null, null, null, null, null), null);
        ApiOperation byPattern = getItem(new ScalarSchemaNode("string", null, null, "^[A-Z]{3}$", null, null, null, null), null);
        ApiOperation byDescription = getItem(ScalarSchemaNode.ofType("string"), "Must be one of: A1, B2");

        assertThat(resolver.resolve(byFormat, TestOperations.spec(byFormat)).get("itemId").basis())
                .isEqualTo(CertaintyBasis.FORMAT);
        assertThat(resolver.resolve(byPattern, TestOperations.spec(byPattern)).get("itemId").basis())
                .isEqualTo(CertaintyBasis.PATTERN);
        assertThat(resolver.resolve(byDescription, TestOperations.spec(byDescription)).get("itemId").basis())
                .isEqualTo(CertaintyBasis.DESCRIPTION_HINT);
    }

    @Test
    void resolveAll_shouldClassifyEveryPathParameterOfParsedSpecification() throws Exception {
        ApiSpecification spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());

        Map<OperationKey, Map<String, ParameterCertainty>> all = resolver.resolveAll(spec);

        assertThat(all).hasSize(spec.getOperations().size());
        spec.getOperations().forEach(operation ->
                assertThat(List.copyOf(all.get(operation.key()).keySet())).isEqualTo(operation.pathParameterNames()));

        Map<String, ParameterCertainty> report = all.get(new OperationKey(ApiMethod.GET, "/reports/{year}/{month}"));
        assertThat(report.get("year").basis()).isEqualTo(CertaintyBasis.BOUNDED_RANGE);
        assertThat(report.get("month").basis()).isEqualTo(CertaintyBasis.NAME_PATTERN);
        assertThat(all.get(new OperationKey(ApiMethod.GET, "/categories/{categoryCode}")).get("categoryCode").basis())
                .isEqualTo(CertaintyBasis.ENUM);

        ParameterCertainty itemId = all.get(new OperationKey(ApiMethod.GET, "/items/{itemId}")).get("itemId");
        assertThat(itemId.isCertain()).isFalse();
        // closest paths first, then declaration order
        assertThat(itemId.dependencyEndpoints()).containsExactly(
                new OperationKey(ApiMethod.PUT, "/items/{itemId}"),
                new OperationKey(ApiMethod.GET, "/items/{itemId}/reviews"),
                new OperationKey(ApiMethod.POST, "/items/{itemId}/reviews"),
                new OperationKey(ApiMethod.GET, "/items"),
                CREATE_ITEM);
    }

    @Test
    void nameTokens_shouldSplitOnCaseAndSeparators() {
        assertThat(ParameterCertaintyResolverImpl.nameTokens("startDate")).isEqualTo(List.of("start", "date"));
        assertThat(ParameterCertaintyResolverImpl.nameTokens("order_id")).isEqualTo(List.of("order", "id"));
        assertThat(ParameterCertaintyResolverImpl.nameTokens("candidateId")).isEqualTo(List.of("candidate", "id"));
    }
}
