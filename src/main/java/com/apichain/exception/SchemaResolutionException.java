package com.apichain.exception;

/**
 * Thrown when a {@code $ref} names a schema the specification does not define.
 * Callers recover by treating the referenced schema as contributing nothing.
 */
public class SchemaResolutionException extends ApiChainException {

    private final String ref;

    public SchemaResolutionException(String ref) {
        super("Cannot resolve schema reference '" + ref + "'");
        this.ref = ref;
    }

    public String getRef() {
        return ref;
    }
}
