package com.apichain.model;

import com.apichain.model.schema.SchemaNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A normalized API operation: one (method, path) pair together with the attribute names it reads
 * and the attribute names its successful responses produce.
 * <p>
 * Instances are built once per specification version and never modified afterwards.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ApiOperation {

    private static final Pattern PATH_TEMPLATE = Pattern.compile("\\{([^}/]+)}");

    /**
     * The {@code operationId} from the document, or one generated from method and path.
     */
    String operationId;

    ApiMethod method;

    /**
     * The path template, e.g. {@code /items/{itemId}}.
     */
    String path;

    String summary;

    @Singular
    List<ApiParameter> parameters;

    /**
     * The JSON request body schema, if the operation accepts one.
     */
    SchemaNode requestBody;

    /**
     * Success-range (2xx) response schemas keyed by status code.
     */
    @Singular
    Map<String, SchemaNode> responses;

    /**
     * The security requirements that apply to this operation. Each entry maps a scheme name to its scopes.
     */
    @Singular("securityRequirement")
    List<Map<String, List<String>>> security;

    /**
     * Names read from path parameters, query parameters and the request body.
     */
    @Singular
    Set<String> inputAttributes;

    /**
     * Names found in the success-range response schemas.
     */
    @Singular
    Set<String> outputAttributes;

    public OperationKey key() {
        return new OperationKey(method, path);
    }

    public String signature() {
        return key().signature();
    }

    /**
     * Path parameter names in template order, followed by any declared path parameters the template does not mention.
     */
    public List<String> pathParameterNames() {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PATH_TEMPLATE.matcher(path);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        parameters.stream()
                .filter(ApiParameter::isPathParameter)
                .map(ApiParameter::getName)
                .forEach(names::add);
        return new ArrayList<>(names);
    }

    public Optional<ApiParameter> findParameter(String name, String in) {
        return parameters.stream()
                .filter(p -> p.getName().equals(name) && in.equals(p.getIn()))
                .findFirst();
    }

    public List<ApiParameter> queryParameters() {
        return parameters.stream().filter(ApiParameter::isQueryParameter).toList();
    }
}
