package com.apichain.service.api;

import com.apichain.model.ApiSpecification;

/**
 * Loads OpenAPI documents into the normalized {@link ApiSpecification} model.
 */
public interface OpenApiService {

    /**
     * Loads and normalizes a specification, computing every operation's input and output attributes.
     *
     * @param source a URL or file path of an OpenAPI 3 (or Swagger 2) document, JSON or YAML.
     * @return the normalized specification, operations in declaration order.
     * @throws com.apichain.exception.ApiChainException if the document cannot be loaded or parsed.
     */
    ApiSpecification loadAndParseSpec(String source);
}
