package com.apichain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The identity of an operation: its HTTP method and path template.
 * <p>
 * The display signature (e.g. {@code "GET /items/{itemId}"}) is derived once at construction and
 * is used for logging and JSON only; equality is defined on the two fields.
 */
@Getter
@EqualsAndHashCode(exclude = "signature")
public final class OperationKey {

    private final ApiMethod method;
    private final String path;
    private final String signature;

    public OperationKey(ApiMethod method, String path) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        this.signature = method.name() + " " + path;
    }

    /**
     * Parses a signature of the form {@code "METHOD /path"}.
     *
     * @throws IllegalArgumentException if the signature is malformed or the method is unsupported.
     */
    @JsonCreator
    public static OperationKey parse(String signature) {
        if (signature == null) {
            throw new IllegalArgumentException("Operation signature must not be null");
        }
        String trimmed = signature.trim();
        int space = trimmed.indexOf(' ');
        if (space <= 0) {
            throw new IllegalArgumentException("Malformed operation signature: '" + signature + "'");
        }
        ApiMethod method = ApiMethod.fromName(trimmed.substring(0, space))
                .orElseThrow(() -> new IllegalArgumentException("Unsupported method in signature: '" + signature + "'"));
        return new OperationKey(method, trimmed.substring(space + 1).trim());
    }

    @JsonValue
    public String signature() {
        return signature;
    }

    @Override
    public String toString() {
        return signature;
    }
}
