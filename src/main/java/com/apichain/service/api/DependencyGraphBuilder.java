package com.apichain.service.api;

import com.apichain.model.ApiOperation;
import com.apichain.model.DependencyGraph;
import java.util.List;

/**
 * Derives which operations depend on data produced by which others.
 */
public interface DependencyGraphBuilder {

    /**
     * Builds the dependency graph over {@code operations}. Operation indices in the result follow the list order.
     */
    DependencyGraph build(List<ApiOperation> operations);
}
