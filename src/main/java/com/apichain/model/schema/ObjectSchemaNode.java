package com.apichain.model.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ObjectSchemaNode(Map<String, SchemaNode> properties, List<String> required, String description)
        implements SchemaNode {

    public ObjectSchemaNode {
        properties = properties == null ? Map.of() : new LinkedHashMap<>(properties);
        required = required == null ? List.of() : List.copyOf(required);
    }

    public boolean isRequired(String property) {
        return required.contains(property);
    }
}
