package com.apichain.model;

import com.apichain.model.schema.SchemaNode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single path, query, header or cookie parameter of an {@link ApiOperation}.
 */
@Value
@Builder
@Jacksonized
public class ApiParameter {

    public static final String IN_PATH = "path";
    public static final String IN_QUERY = "query";

    /**
     * The name of the parameter.
     */
    String name;

    /**
     * The location of the parameter: "path", "query", "header" or "cookie".
     */
    String in;

    boolean required;

    String description;

    /**
     * The parameter's schema; {@code null} when the document declares none.
     */
    SchemaNode schema;

    @JsonIgnore
    public boolean isPathParameter() {
        return IN_PATH.equals(in);
    }

    @JsonIgnore
    public boolean isQueryParameter() {
        return IN_QUERY.equals(in);
    }
}
