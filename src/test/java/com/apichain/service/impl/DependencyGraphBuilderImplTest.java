package com.apichain.service.impl;

import com.apichain.TestOperations;
import com.apichain.model.ApiMethod;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.AttributeMapping;
import com.apichain.model.DependencyEdge;
import com.apichain.model.DependencyGraph;
import com.apichain.model.OperationDependency;
import com.apichain.model.OperationKey;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.apichain.TestOperations.op;
import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphBuilderImplTest {

    private DependencyGraphBuilderImpl builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilderImpl();
    }

    @Test
    void build_shouldLinkCreatedIdToNestedPathParameter() {
        ApiOperation create = op(ApiMethod.POST, "/items", Set.of("name"), Set.of("id"));
        ApiOperation fetch = op(ApiMethod.GET, "/items/{itemId}", Set.of("itemId"), Set.of("name"));

        DependencyGraph graph = builder.build(List.of(create, fetch));

        assertThat(graph.edges()).hasSize(1);
        OperationDependency dependency = graph.toDependency(graph.edges().get(0));
        assertThat(dependency.source()).isEqualTo(new OperationKey(ApiMethod.POST, "/items"));
        assertThat(dependency.target()).isEqualTo(new OperationKey(ApiMethod.GET, "/items/{itemId}"));
        assertThat(dependency.dataMapping()).containsExactly(new AttributeMapping("id", "itemId"));
    }

    @Test
    void build_shouldRespectMethodPrecedenceOnSamePath() {
        ApiOperation put = op(ApiMethod.PUT, "/items/{itemId}", Set.of("itemId", "name"), Set.of("name"));
        ApiOperation get = op(ApiMethod.GET, "/items/{itemId}", Set.of("itemId"), Set.of("itemId", "name"));
        ApiOperation delete = op(ApiMethod.DELETE, "/items/{itemId}", Set.of("itemId"), Set.of("itemId"));

        DependencyGraph graph = builder.build(List.of(put, get, delete));

        // indices: 0 = PUT, 1 = GET, 2 = DELETE
        assertThat(graph.hasEdge(1, 0)).isTrue();
        assertThat(graph.hasEdge(0, 1)).isFalse();
        assertThat(graph.hasEdge(1, 2)).isTrue();
        assertThat(graph.outgoing(2)).isEmpty();
    }

    @Test
    void build_shouldNotLinkUnrelatedPathsOrDisjointAttributes() {
        ApiOperation users = op(ApiMethod.POST, "/users", Set.of("name"), Set.of("id", "name"));
        ApiOperation items = op(ApiMethod.GET, "/items/{itemId}", Set.of("itemId", "name"), Set.of());
        ApiOperation nested = op(ApiMethod.GET, "/users/{userId}/avatar", Set.of("size"), Set.of());

        DependencyGraph graph = builder.build(List.of(users, items, nested));

        assertThat(graph.edges()).isEmpty();
    }

    @Test
    void build_shouldProduceWellFormedGraphForParsedSpecification() throws Exception {
        ApiSpecification spec = new OpenApiServiceImpl().loadAndParseSpec(TestOperations.fixturePath());

        DependencyGraph graph = builder.build(spec.getOperations());

        assertThat(graph.size()).isEqualTo(spec.getOperations().size());
        for (DependencyEdge edge : graph.edges()) {
            ApiOperation source = graph.operation(edge.source());
            ApiOperation target = graph.operation(edge.target());
            assertThat(edge.source()).isNotEqualTo(edge.target());
            assertThat(edge.mappings()).isNotEmpty();
            assertThat(source.getMethod()).isNotEqualTo(ApiMethod.DELETE);
            if (source.getPath().equals(target.getPath())) {
                assertThat(source.getMethod().precedes(target.getMethod())).isTrue();
            } else {
                assertThat(target.getPath()).startsWith(source.getPath());
            }
        }

        int createItem = graph.indexOf(new OperationKey(ApiMethod.POST, "/items"));
        int getItem = graph.indexOf(new OperationKey(ApiMethod.GET, "/items/{itemId}"));
        int listReviews = graph.indexOf(new OperationKey(ApiMethod.GET, "/items/{itemId}/reviews"));
        int createReview = graph.indexOf(new OperationKey(ApiMethod.POST, "/items/{itemId}/reviews"));
        int report = graph.indexOf(new OperationKey(ApiMethod.GET, "/reports/{year}/{month}"));

        assertThat(graph.edge(createItem, getItem)).hasValueSatisfying(edge ->
                assertThat(edge.mappings()).contains(new AttributeMapping("id", "itemId")));
        assertThat(graph.hasEdge(createReview, listReviews)).isTrue();
        assertThat(graph.hasEdge(listReviews, createReview)).isFalse();
        assertThat(graph.incoming(report)).isEmpty();
        assertThat(graph.outgoing(report)).isEmpty();
    }
}
