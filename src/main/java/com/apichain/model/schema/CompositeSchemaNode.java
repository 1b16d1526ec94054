package com.apichain.model.schema;

import java.util.List;

/**
 * The members of an {@code allOf}, {@code oneOf} or {@code anyOf} schema.
 */
public record CompositeSchemaNode(List<SchemaNode> members) implements SchemaNode {

    public CompositeSchemaNode {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
