package com.apichain.service.support;

import com.apichain.exception.SchemaResolutionException;
import com.apichain.model.ApiSpecification;
import com.apichain.model.schema.RefSchemaNode;
import com.apichain.model.schema.SchemaNode;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolves {@code #/components/schemas/...} references against a specification's schema index.
 */
public class SchemaResolver {

    private final Map<String, SchemaNode> schemas;

    public SchemaResolver(Map<String, SchemaNode> schemas) {
        this.schemas = schemas == null ? Map.of() : schemas;
    }

    public static SchemaResolver of(ApiSpecification spec) {
        return new SchemaResolver(spec.getSchemas());
    }

    /**
     * Resolves one level of indirection.
     *
     * @throws SchemaResolutionException if the reference is not a component reference or names no schema.
     */
    public SchemaNode resolve(RefSchemaNode ref) {
        String value = ref.ref();
        if (value == null || !value.startsWith(RefSchemaNode.COMPONENTS_PREFIX)) {
            throw new SchemaResolutionException(value);
        }
        SchemaNode target = schemas.get(value.substring(RefSchemaNode.COMPONENTS_PREFIX.length()));
        if (target == null) {
            throw new SchemaResolutionException(value);
        }
        return target;
    }

    /**
     * Follows references until a non-reference node is reached.
     *
     * @throws SchemaResolutionException if a reference is unresolvable or the references form a loop.
     */
    public SchemaNode dereference(SchemaNode node) {
        Set<String> seen = new HashSet<>();
        SchemaNode current = node;
        while (current instanceof RefSchemaNode ref) {
            if (!seen.add(ref.ref())) {
                throw new SchemaResolutionException(ref.ref());
            }
            current = resolve(ref);
        }
        return current;
    }
}
