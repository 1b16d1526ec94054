package com.apichain;

import com.apichain.model.ApiMethod;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiParameter;
import com.apichain.model.ApiSpecification;
import com.apichain.model.schema.SchemaNode;
import java.net.URL;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Small builders for operations and specifications used across tests.
 */
public final class TestOperations {

    private TestOperations() {
    }

    public static ApiOperation op(ApiMethod method, String path, Set<String> inputs, Set<String> outputs) {
        return ApiOperation.builder()
                .operationId(method.name().toLowerCase() + path.replaceAll("[^A-Za-z]", "_"))
                .method(method)
                .path(path)
                .inputAttributes(inputs)
                .outputAttributes(outputs)
                .build();
    }

    public static ApiParameter pathParam(String name, SchemaNode schema) {
        return ApiParameter.builder().name(name).in(ApiParameter.IN_PATH).required(true).schema(schema).build();
    }

    public static ApiParameter pathParam(String name, SchemaNode schema, String description) {
        return ApiParameter.builder().name(name).in(ApiParameter.IN_PATH).required(true).schema(schema).description(description).build();
    }

    public static ApiSpecification spec(ApiOperation... operations) {
        ApiSpecification spec = new ApiSpecification();
        spec.setOperations(new ArrayList<>(List.of(operations)));
        return spec;
    }

    public static String fixturePath() throws Exception {
        URL resource = TestOperations.class.getClassLoader().getResource("test-openapi.json");
        if (resource == null) {
            throw new IllegalStateException("test-openapi.json is missing from the test classpath");
        }
        return Paths.get(resource.toURI()).toFile().getAbsolutePath();
    }
}
