package com.apichain.service.impl;

import com.apichain.model.ApiMethod;
import com.apichain.model.ApiOperation;
import com.apichain.model.AttributeMapping;
import com.apichain.model.DependencyEdge;
import com.apichain.model.DependencyGraph;
import com.apichain.service.api.DependencyGraphBuilder;
import com.apichain.service.support.AttributeMatcher;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Connects {@code u -> v} when {@code v} can consume something {@code u} produces:
 * <ul>
 *     <li>a DELETE never produces;</li>
 *     <li>on the same path, {@code u}'s method must precede {@code v}'s ({@code post < get < put < patch < delete});</li>
 *     <li>across paths, {@code v}'s path must start with {@code u}'s path;</li>
 *     <li>and at least one output of {@code u} must feed an input of {@code v}.</li>
 * </ul>
 * Attribute names are compared exactly, except that a path parameter of {@code v} may also be fed under
 * {@link AttributeMatcher} rules, so {@code POST /items} producing {@code id} feeds {@code GET /items/{itemId}}.
 */
@Service
@Slf4j
public class DependencyGraphBuilderImpl implements DependencyGraphBuilder {

    @Override
    public DependencyGraph build(List<ApiOperation> operations) {
        List<DependencyEdge> edges = new ArrayList<>();
        for (int u = 0; u < operations.size(); u++) {
            for (int v = 0; v < operations.size(); v++) {
                if (u == v) {
                    continue;
                }
                connect(u, operations.get(u), v, operations.get(v)).ifPresent(edge -> {
                    log.debug("  Edge {} -> {} via {}", operations.get(edge.source()).signature(),
                            operations.get(edge.target()).signature(), edge.mappings());
                    edges.add(edge);
                });
            }
        }
        log.info("Built dependency graph: {} operations, {} edges.", operations.size(), edges.size());
        return new DependencyGraph(operations, edges);
    }

    private Optional<DependencyEdge> connect(int uIndex, ApiOperation u, int vIndex, ApiOperation v) {
        if (u.getMethod() == ApiMethod.DELETE) {
            return Optional.empty();
        }
        String reason;
        if (u.getPath().equals(v.getPath())) {
            if (!u.getMethod().precedes(v.getMethod())) {
                return Optional.empty();
            }
            reason = u.getMethod() + " precedes " + v.getMethod() + " on " + u.getPath();
        } else if (v.getPath().startsWith(u.getPath())) {
            reason = v.getPath() + " is nested under " + u.getPath();
        } else {
            return Optional.empty();
        }

        List<AttributeMapping> mappings = sharedAttributes(u, v);
        if (mappings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DependencyEdge(uIndex, vIndex, mappings, reason));
    }

    private List<AttributeMapping> sharedAttributes(ApiOperation u, ApiOperation v) {
        List<AttributeMapping> mappings = new ArrayList<>();
        Set<String> fed = new HashSet<>();
        for (String output : u.getOutputAttributes()) {
            if (v.getInputAttributes().contains(output)) {
                mappings.add(new AttributeMapping(output, output));
                fed.add(output);
            }
        }
        for (String pathParameter : v.pathParameterNames()) {
            if (fed.contains(pathParameter)) {
                continue;
            }
            u.getOutputAttributes().stream()
                    .filter(output -> AttributeMatcher.matches(output, pathParameter, u.getPath()))
                    .findFirst()
                    .ifPresent(output -> {
                        mappings.add(new AttributeMapping(output, pathParameter));
                        fed.add(pathParameter);
                    });
        }
        return mappings;
    }
}
