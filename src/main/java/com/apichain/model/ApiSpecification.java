package com.apichain.model;

import com.apichain.model.schema.SchemaNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Data;

/**
 * A normalized OpenAPI document: the operation list in declaration order plus the component
 * schemas and security schemes the operations refer to.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class ApiSpecification {

    private String title;

    /**
     * Operations in declaration order (path order, then method order within a path).
     */
    private List<ApiOperation> operations = new ArrayList<>();

    /**
     * Component schemas keyed by name, used to resolve {@code #/components/schemas/...} references.
     */
    private Map<String, SchemaNode> schemas = new LinkedHashMap<>();

    private Map<String, SecuritySchemeInfo> securitySchemes = new LinkedHashMap<>();

    /**
     * Document-level security requirements, applied to operations that declare none.
     */
    private List<Map<String, List<String>>> security = new ArrayList<>();

    /**
     * Base server URLs declared by the document. The first one is used when the caller supplies none.
     */
    private List<String> serverUrls = new ArrayList<>();

    public Optional<ApiOperation> findOperation(OperationKey key) {
        return operations.stream().filter(op -> op.key().equals(key)).findFirst();
    }
}
