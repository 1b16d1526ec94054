package com.apichain.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A leaf schema (string, integer, number, boolean) with the constraints used to decide whether a
 * value can be invented from the schema alone.
 */
public record ScalarSchemaNode(String type,
                               String format,
                               List<Object> enumValues,
                               String pattern,
                               BigDecimal minimum,
                               BigDecimal maximum,
                               String description,
                               Object example) implements SchemaNode {

    public ScalarSchemaNode {
        enumValues = enumValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(enumValues));
    }

    public static ScalarSchemaNode ofType(String type) {
        return new ScalarSchemaNode(type, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isNumeric() {
        return "integer".equals(type) || "number".equals(type);
    }
}
