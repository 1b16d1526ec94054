package com.apichain.service.impl;

import com.apichain.exception.ApiChainException;
import com.apichain.model.ApiMethod;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiParameter;
import com.apichain.model.ApiSpecification;
import com.apichain.model.SecuritySchemeInfo;
import com.apichain.model.schema.ArraySchemaNode;
import com.apichain.model.schema.CompositeSchemaNode;
import com.apichain.model.schema.ObjectSchemaNode;
import com.apichain.model.schema.RefSchemaNode;
import com.apichain.model.schema.ScalarSchemaNode;
import com.apichain.model.schema.SchemaNode;
import com.apichain.service.api.OpenApiService;
import com.apichain.service.support.AttributeExtractor;
import com.apichain.service.support.SchemaResolver;
import io.swagger.parser.OpenAPIParser;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiServiceImpl implements OpenApiService {

    private static final String PARAMETER_REF_PREFIX = "#/components/parameters/";
    private static final String REQUEST_BODY_REF_PREFIX = "#/components/requestBodies/";
    private static final String RESPONSE_REF_PREFIX = "#/components/responses/";

    /**
     * {@inheritDoc}
     * <p>
     * This implementation uses swagger-parser to read the document, converts every schema into the
     * {@link SchemaNode} variant while keeping {@code $ref}s to component schemas, and then computes
     * each operation's attribute sets in parallel, since operations are independent of each other.
     */
    @Override
    public ApiSpecification loadAndParseSpec(String source) {
        log.info("Loading and parsing OpenAPI spec from: {}", source);
        OpenAPI openAPI = read(source);

        ApiSpecification spec = new ApiSpecification();
        if (openAPI.getInfo() != null) {
            spec.setTitle(openAPI.getInfo().getTitle());
        }
        if (openAPI.getServers() != null) {
            spec.setServerUrls(openAPI.getServers().stream().map(s -> s.getUrl()).toList());
        }
        if (openAPI.getSecurity() != null) {
            spec.setSecurity(openAPI.getSecurity().stream().map(this::toRequirement).toList());
        }
        if (openAPI.getComponents() != null) {
            if (openAPI.getComponents().getSchemas() != null) {
                Map<String, SchemaNode> schemas = new LinkedHashMap<>();
                openAPI.getComponents().getSchemas().forEach((name, schema) -> schemas.put(name, toNode(schema)));
                spec.setSchemas(schemas);
            }
            if (openAPI.getComponents().getSecuritySchemes() != null) {
                Map<String, SecuritySchemeInfo> schemes = new LinkedHashMap<>();
                openAPI.getComponents().getSecuritySchemes().forEach((name, scheme) -> schemes.put(name,
                        new SecuritySchemeInfo(
                                scheme.getType() == null ? null : scheme.getType().toString(),
                                scheme.getIn() == null ? null : scheme.getIn().toString(),
                                scheme.getName(),
                                scheme.getScheme(),
                                scheme.getDescription())));
                spec.setSecuritySchemes(schemes);
            }
        }

        List<ApiOperation> drafts = new ArrayList<>();
        if (openAPI.getPaths() != null) {
            openAPI.getPaths().forEach((path, pathItem) ->
                    pathItem.readOperationsMap().forEach((method, operation) -> {
                        Optional<ApiMethod> apiMethod = ApiMethod.fromName(method.name());
                        if (apiMethod.isEmpty()) {
                            log.debug("Skipping unsupported method {} {}", method, path);
                            return;
                        }
                        drafts.add(createApiOperation(apiMethod.get(), operation, path, pathItem, openAPI));
                    }));
        }

        AttributeExtractor extractor = new AttributeExtractor(SchemaResolver.of(spec));
        List<ApiOperation> operations = drafts.parallelStream()
                .map(op -> op.toBuilder()
                        .inputAttributes(extractor.inputAttributes(op.getParameters(), op.getRequestBody()))
                        .outputAttributes(extractor.outputAttributes(op.getResponses().values()))
                        .build())
                .toList();

        spec.setOperations(new ArrayList<>(operations));
        log.info("Successfully parsed {} operations from the specification.", operations.size());
        return spec;
    }

    private OpenAPI read(String source) {
        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        SwaggerParseResult result;
        try {
            result = new OpenAPIParser().readLocation(source, null, options);
        } catch (RuntimeException e) {
            throw new ApiChainException("Failed to load the OpenAPI specification from the source: " + source, e);
        }
        if (result == null || result.getOpenAPI() == null) {
            List<String> messages = result == null || result.getMessages() == null ? List.of() : result.getMessages();
            throw new ApiChainException("Failed to load or parse the OpenAPI specification from the source: "
                    + source + (messages.isEmpty() ? "" : " " + messages));
        }
        if (result.getMessages() != null && !result.getMessages().isEmpty()) {
            log.warn("The specification at {} has issues: {}", source, result.getMessages());
        }
        return result.getOpenAPI();
    }

    private ApiOperation createApiOperation(ApiMethod method, Operation operation, String path, PathItem pathItem, OpenAPI openAPI) {
        String operationId = operation.getOperationId() != null
                ? operation.getOperationId()
                : generateOperationId(method.name(), path);

        ApiOperation.ApiOperationBuilder builder = ApiOperation.builder()
                .operationId(operationId)
                .method(method)
                .path(path)
                .summary(operation.getSummary() != null ? operation.getSummary() : operation.getDescription())
                .parameters(mergeParameters(pathItem.getParameters(), operation.getParameters(), openAPI));

        if (operation.getSecurity() != null) {
            builder.security(operation.getSecurity().stream().map(this::toRequirement).toList());
        }

        RequestBody requestBody = resolveRequestBody(operation.getRequestBody(), openAPI);
        if (requestBody != null) {
            jsonSchema(requestBody.getContent()).ifPresent(schema -> builder.requestBody(toNode(schema)));
        }

        if (operation.getResponses() != null) {
            operation.getResponses().forEach((code, response) -> {
                if (!code.startsWith("2")) {
                    return;
                }
                ApiResponse resolved = resolveResponse(response, openAPI);
                if (resolved != null) {
                    jsonSchema(resolved.getContent()).ifPresent(schema -> builder.response(code, toNode(schema)));
                }
            });
        }
        return builder.build();
    }

    /**
     * Path-item parameters apply to every operation of the path; an operation parameter with the same
     * name and location replaces one declared on the path item.
     */
    private List<ApiParameter> mergeParameters(List<Parameter> pathLevel, List<Parameter> operationLevel, OpenAPI openAPI) {
        Map<String, ApiParameter> merged = new LinkedHashMap<>();
        for (List<Parameter> level : List.of(
                pathLevel == null ? List.<Parameter>of() : pathLevel,
                operationLevel == null ? List.<Parameter>of() : operationLevel)) {
            for (Parameter raw : level) {
                Parameter parameter = resolveParameter(raw, openAPI);
                if (parameter == null || parameter.getName() == null) {
                    continue;
                }
                merged.put(parameter.getIn() + ":" + parameter.getName(), ApiParameter.builder()
                        .name(parameter.getName())
                        .in(parameter.getIn())
                        .required(Boolean.TRUE.equals(parameter.getRequired()))
                        .description(parameter.getDescription())
                        .schema(toNode(parameter.getSchema()))
                        .build());
            }
        }
        return new ArrayList<>(merged.values());
    }

    private Parameter resolveParameter(Parameter parameter, OpenAPI openAPI) {
        if (parameter.get$ref() == null) {
            return parameter;
        }
        Parameter resolved = componentLookup(parameter.get$ref(), PARAMETER_REF_PREFIX,
                openAPI.getComponents() == null ? null : openAPI.getComponents().getParameters());
        if (resolved == null) {
            log.warn("Cannot resolve parameter reference '{}'; skipping it", parameter.get$ref());
        }
        return resolved;
    }

    private RequestBody resolveRequestBody(RequestBody requestBody, OpenAPI openAPI) {
        if (requestBody == null || requestBody.get$ref() == null) {
            return requestBody;
        }
        return componentLookup(requestBody.get$ref(), REQUEST_BODY_REF_PREFIX,
                openAPI.getComponents() == null ? null : openAPI.getComponents().getRequestBodies());
    }

    private ApiResponse resolveResponse(ApiResponse response, OpenAPI openAPI) {
        if (response == null || response.get$ref() == null) {
            return response;
        }
        return componentLookup(response.get$ref(), RESPONSE_REF_PREFIX,
                openAPI.getComponents() == null ? null : openAPI.getComponents().getResponses());
    }

    private <T> T componentLookup(String ref, String prefix, Map<String, T> components) {
        if (components == null || !ref.startsWith(prefix)) {
            return null;
        }
        return components.get(ref.substring(prefix.length()));
    }

    /**
     * Picks {@code application/json}, then any JSON-like media type, then whatever comes first.
     */
    private Optional<Schema<?>> jsonSchema(Content content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        MediaType chosen = content.get("application/json");
        if (chosen == null) {
            chosen = content.entrySet().stream()
                    .filter(e -> e.getKey().toLowerCase().contains("json"))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(content.values().iterator().next());
        }
        return Optional.ofNullable(chosen.getSchema());
    }

    /**
     * Converts a swagger schema into the {@link SchemaNode} variant. References to component schemas are
     * kept as {@link RefSchemaNode}s and resolved lazily, which keeps cyclic schemas finite.
     */
    private SchemaNode toNode(Schema<?> schema) {
        if (schema == null) {
            return null;
        }
        if (schema.get$ref() != null) {
            return new RefSchemaNode(schema.get$ref());
        }

        List<Schema> composed = new ArrayList<>();
        if (schema.getAllOf() != null) {
            composed.addAll(schema.getAllOf());
        }
        if (schema.getOneOf() != null) {
            composed.addAll(schema.getOneOf());
        }
        if (schema.getAnyOf() != null) {
            composed.addAll(schema.getAnyOf());
        }
        if (!composed.isEmpty()) {
            List<SchemaNode> members = new ArrayList<>();
            composed.forEach(member -> members.add(toNode(member)));
            if (schema.getProperties() != null) {
                members.add(toObjectNode(schema));
            }
            return new CompositeSchemaNode(members);
        }

        String type = typeOf(schema);
        if ("array".equals(type) || schema.getItems() != null) {
            return new ArraySchemaNode(toNode(schema.getItems()));
        }
        if ("object".equals(type) || schema.getProperties() != null) {
            return toObjectNode(schema);
        }
        return new ScalarSchemaNode(
                type,
                schema.getFormat(),
                schema.getEnum() == null ? null : new ArrayList<Object>(schema.getEnum()),
                schema.getPattern(),
                schema.getMinimum(),
                schema.getMaximum(),
                schema.getDescription(),
                schema.getExample());
    }

    private ObjectSchemaNode toObjectNode(Schema<?> schema) {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        if (schema.getProperties() != null) {
            schema.getProperties().forEach((name, property) -> properties.put(name, toNode(property)));
        }
        return new ObjectSchemaNode(properties, schema.getRequired(), schema.getDescription());
    }

    /**
     * OpenAPI 3.0 documents carry a single type; 3.1 documents carry a set that may include "null".
     */
    private String typeOf(Schema<?> schema) {
        if (schema.getType() != null) {
            return schema.getType();
        }
        if (schema.getTypes() != null) {
            return schema.getTypes().stream().filter(t -> !"null".equals(t)).findFirst().orElse(null);
        }
        return null;
    }

    private Map<String, List<String>> toRequirement(SecurityRequirement requirement) {
        return new LinkedHashMap<>(requirement);
    }

    private String generateOperationId(String httpMethod, String path) {
        String sanitizedPath = path
                .replaceAll("\\{", "by_")
                .replaceAll("[{}/]", "_")
                .replaceAll("__", "_")
                .replaceAll("^_|_$", "");
        return httpMethod.toLowerCase() + "_" + sanitizedPath;
    }
}
