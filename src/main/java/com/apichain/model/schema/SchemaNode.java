package com.apichain.model.schema;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a normalized JSON schema. Every schema is exactly one of an object, an array,
 * a reference to a component schema, a scalar, or a composite (allOf/oneOf/anyOf).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ObjectSchemaNode.class, name = "object"),
        @JsonSubTypes.Type(value = ArraySchemaNode.class, name = "array"),
        @JsonSubTypes.Type(value = RefSchemaNode.class, name = "ref"),
        @JsonSubTypes.Type(value = ScalarSchemaNode.class, name = "scalar"),
        @JsonSubTypes.Type(value = CompositeSchemaNode.class, name = "composite")
})
public interface SchemaNode {
}
