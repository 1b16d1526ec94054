package com.apichain.service.support;

import com.apichain.exception.SchemaResolutionException;
import com.apichain.model.ApiParameter;
import com.apichain.model.schema.ArraySchemaNode;
import com.apichain.model.schema.CompositeSchemaNode;
import com.apichain.model.schema.ObjectSchemaNode;
import com.apichain.model.schema.RefSchemaNode;
import com.apichain.model.schema.SchemaNode;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects the attribute names a schema mentions: object property names at any depth, reached through
 * array items, composite members and references.
 * <p>
 * Each reference is followed at most once per extraction, so self-referential schemas terminate.
 * An unresolvable reference contributes no names.
 */
@Slf4j
public class AttributeExtractor {

    private final SchemaResolver resolver;

    public AttributeExtractor(SchemaResolver resolver) {
        this.resolver = resolver;
    }

    public Set<String> extract(SchemaNode root) {
        Set<String> names = new LinkedHashSet<>();
        collect(root, new HashSet<>(), names);
        return names;
    }

    /**
     * Path and query parameter names followed by the request body's attribute names.
     */
    public Set<String> inputAttributes(List<ApiParameter> parameters, SchemaNode requestBody) {
        Set<String> names = new LinkedHashSet<>();
        parameters.stream()
                .filter(p -> p.isPathParameter() || p.isQueryParameter())
                .map(ApiParameter::getName)
                .forEach(names::add);
        names.addAll(extract(requestBody));
        return names;
    }

    public Set<String> outputAttributes(Collection<SchemaNode> successResponses) {
        Set<String> names = new LinkedHashSet<>();
        successResponses.forEach(schema -> names.addAll(extract(schema)));
        return names;
    }

    private void collect(SchemaNode node, Set<String> visitedRefs, Set<String> names) {
        if (node == null) {
            return;
        }
        if (node instanceof RefSchemaNode ref) {
            if (!visitedRefs.add(ref.ref())) {
                return;
            }
            SchemaNode target;
            try {
                target = resolver.resolve(ref);
            } catch (SchemaResolutionException e) {
                log.warn("{}; treating it as having no attributes", e.getMessage());
                return;
            }
            collect(target, visitedRefs, names);
        } else if (node instanceof ObjectSchemaNode object) {
            object.properties().forEach((name, child) -> {
                names.add(name);
                collect(child, visitedRefs, names);
            });
        } else if (node instanceof ArraySchemaNode array) {
            collect(array.items(), visitedRefs, names);
        } else if (node instanceof CompositeSchemaNode composite) {
            composite.members().forEach(member -> collect(member, visitedRefs, names));
        }
    }
}
