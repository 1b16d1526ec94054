package com.apichain.cli;

import com.apichain.dto.response.CommandResponse;
import com.apichain.model.ApiSpecification;
import com.apichain.model.DependencyGraph;
import com.apichain.model.OperationDependency;
import com.apichain.model.OperationKey;
import com.apichain.model.ParameterCertainty;
import com.apichain.service.api.DependencyGraphBuilder;
import com.apichain.service.api.ParameterCertaintyResolver;
import com.apichain.service.api.StateService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Commands that show the static analysis of an API: the dependency graph and the certainty of path parameters.
 */
@ShellComponent
public class GraphCommand {

    private final StateService stateService;
    private final DependencyGraphBuilder graphBuilder;
    private final ParameterCertaintyResolver certaintyResolver;

    public GraphCommand(StateService stateService, DependencyGraphBuilder graphBuilder, ParameterCertaintyResolver certaintyResolver) {
        this.stateService = stateService;
        this.graphBuilder = graphBuilder;
        this.certaintyResolver = certaintyResolver;
    }

    @ShellMethod(key = "graph", value = "Show which operations depend on which, and through which attributes.")
    public String graph(@ShellOption(help = "The alias of the API.") String alias) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            return CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString();
        }
        DependencyGraph graph = graphBuilder.build(spec.getOperations());
        List<String> lines = new ArrayList<>();
        for (OperationDependency dependency : graph.toDependencies()) {
            String mapping = dependency.dataMapping().stream()
                    .map(m -> m.sourceAttribute().equals(m.targetAttribute())
                            ? m.sourceAttribute()
                            : m.sourceAttribute() + "->" + m.targetAttribute())
                    .collect(Collectors.joining(", "));
            lines.add("  " + dependency.source() + "  =>  " + dependency.target() + "  [" + mapping + "]  " + dependency.reason());
        }
        return CommandResponse.ok(graph.size() + " operations, " + graph.edges().size() + " dependencies for '" + alias + "'.", lines)
                .toAnsiString();
    }

    @ShellMethod(key = "certainty", value = "Show whether each path parameter can be invented or must come from another response.")
    public String certainty(@ShellOption(help = "The alias of the API.") String alias) {
        ApiSpecification spec = stateService.getSpecification(alias);
        if (spec == null) {
            return CommandResponse.error("No API found with alias '" + alias + "'.").toAnsiString();
        }
        Map<OperationKey, Map<String, ParameterCertainty>> all = certaintyResolver.resolveAll(spec);
        List<String> lines = new ArrayList<>();
        int uncertain = 0;
        for (Map.Entry<OperationKey, Map<String, ParameterCertainty>> entry : all.entrySet()) {
            for (ParameterCertainty certainty : entry.getValue().values()) {
                if (certainty.isCertain()) {
                    lines.add("  " + entry.getKey() + "  {" + certainty.parameterName() + "}  certain (" + certainty.basis() + ")");
                } else {
                    uncertain++;
                    lines.add("  " + entry.getKey() + "  {" + certainty.parameterName() + "}  uncertain, from "
                            + (certainty.dependencyEndpoints().isEmpty() ? "nothing" : certainty.dependencyEndpoints()));
                }
            }
        }
        return CommandResponse.ok(lines.size() + " path parameters, " + uncertain + " uncertain.", lines).toAnsiString();
    }
}
