package com.apichain.model.schema;

/**
 * A {@code $ref} to another schema, kept unresolved so that cyclic schemas can be represented.
 */
public record RefSchemaNode(String ref) implements SchemaNode {

    public static final String COMPONENTS_PREFIX = "#/components/schemas/";

    public static RefSchemaNode toComponent(String name) {
        return new RefSchemaNode(COMPONENTS_PREFIX + name);
    }
}
