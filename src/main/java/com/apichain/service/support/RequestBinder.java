package com.apichain.service.support;

import com.apichain.exception.SchemaResolutionException;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiParameter;
import com.apichain.model.ParameterCertainty;
import com.apichain.model.schema.ArraySchemaNode;
import com.apichain.model.schema.ObjectSchemaNode;
import com.apichain.model.schema.SchemaNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the path, query and body values of one step from the run's binding table,
 * falling back to invented values where the schema allows it.
 */
@Slf4j
public class RequestBinder {

    private static final int MAX_BODY_DEPTH = 3;

    /**
     * The values a step will send. {@code unresolved} lists the path parameters that received the
     * {@link StaticValueGenerator#UNRESOLVED} sentinel.
     */
    public record BoundRequest(Map<String, Object> pathValues,
                               Map<String, Object> queryValues,
                               Object body,
                               List<String> unresolved) {

        public boolean isResolved() {
            return unresolved.isEmpty();
        }
    }

    private final SchemaResolver resolver;

    public RequestBinder(SchemaResolver resolver) {
        this.resolver = resolver;
    }

    public BoundRequest bind(ApiOperation operation,
                             Map<String, ParameterCertainty> certainty,
                             ValueBindingTable table,
                             Map<String, Object> suppliedBody) {
        Map<String, Object> pathValues = new LinkedHashMap<>();
        List<String> unresolved = new ArrayList<>();
        for (String name : operation.pathParameterNames()) {
            Optional<ValueBindingTable.Binding> bound = table.lookupLoose(name);
            if (bound.isPresent()) {
                pathValues.put(name, bound.get().value());
                log.debug("  Path parameter '{}' bound to {} (from {})", name, bound.get().value(), bound.get().source());
            } else if (certainty.containsKey(name) && certainty.get(name).isCertain()) {
                Object value = StaticValueGenerator.generate(name, schemaOf(operation.findParameter(name, ApiParameter.IN_PATH)));
                pathValues.put(name, value);
                log.debug("  Path parameter '{}' generated as {}", name, value);
            } else {
                pathValues.put(name, StaticValueGenerator.UNRESOLVED);
                unresolved.add(name);
                log.debug("  Path parameter '{}' has no value yet", name);
            }
        }

        Map<String, Object> queryValues = new LinkedHashMap<>();
        for (ApiParameter parameter : operation.queryParameters()) {
            Optional<ValueBindingTable.Binding> bound = table.lookup(parameter.getName());
            if (bound.isPresent()) {
                queryValues.put(parameter.getName(), bound.get().value());
            } else if (parameter.isRequired()) {
                queryValues.put(parameter.getName(), StaticValueGenerator.generate(parameter.getName(), dereference(parameter.getSchema())));
            }
        }
        // a name substituted into the path never also goes on the query string
        queryValues.keySet().removeAll(pathValues.keySet());

        return new BoundRequest(pathValues, queryValues, buildBody(operation, table, suppliedBody), unresolved);
    }

    private Object buildBody(ApiOperation operation, ValueBindingTable table, Map<String, Object> suppliedBody) {
        SchemaNode schema = dereference(operation.getRequestBody());
        if (schema == null && suppliedBody == null) {
            return null;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        if (schema instanceof ObjectSchemaNode object) {
            body.putAll(requiredFields(object, 0));
            object.properties().keySet().forEach(name ->
                    table.lookup(name).ifPresent(binding -> body.put(name, binding.value())));
        }
        if (suppliedBody != null) {
            body.putAll(suppliedBody);
        }
        return body;
    }

    private Map<String, Object> requiredFields(ObjectSchemaNode object, int depth) {
        Map<String, Object> fields = new LinkedHashMap<>();
        object.properties().forEach((name, child) -> {
            if (!object.isRequired(name)) {
                return;
            }
            SchemaNode resolved = dereference(child);
            if (resolved instanceof ObjectSchemaNode nested) {
                fields.put(name, depth < MAX_BODY_DEPTH ? requiredFields(nested, depth + 1) : Map.of());
            } else if (resolved instanceof ArraySchemaNode) {
                fields.put(name, List.of());
            } else {
                fields.put(name, StaticValueGenerator.generate(name, resolved));
            }
        });
        return fields;
    }

    private SchemaNode schemaOf(Optional<ApiParameter> parameter) {
        return parameter.map(p -> dereference(p.getSchema())).orElse(null);
    }

    private SchemaNode dereference(SchemaNode schema) {
        if (schema == null) {
            return null;
        }
        try {
            return resolver.dereference(schema);
        } catch (SchemaResolutionException e) {
            log.warn("{}; generating a value from the name only", e.getMessage());
            return null;
        }
    }
}
