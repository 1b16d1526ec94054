package com.apichain.model.schema;

public record ArraySchemaNode(SchemaNode items) implements SchemaNode {
}
