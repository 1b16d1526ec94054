package com.apichain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The parts of an OpenAPI security scheme needed to attach a credential to a request.
 *
 * @param type   "apiKey", "http", "oauth2" or "openIdConnect".
 * @param in     for API keys: "header", "query" or "cookie".
 * @param name   for API keys: the header, query or cookie name.
 * @param scheme for HTTP schemes: "bearer" or "basic".
 */
public record SecuritySchemeInfo(String type, String in, String name, String scheme, String description) {

    @JsonIgnore
    public boolean isApiKey() {
        return "apiKey".equalsIgnoreCase(type);
    }

    @JsonIgnore
    public boolean isHttp() {
        return "http".equalsIgnoreCase(type);
    }

    @JsonIgnore
    public boolean isOAuth() {
        return "oauth2".equalsIgnoreCase(type) || "openIdConnect".equalsIgnoreCase(type);
    }
}
