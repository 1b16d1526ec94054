package com.apichain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The HTTP methods an operation may use, declared in their precedence order.
 * <p>
 * The declaration order is significant: for two operations on the same path, a dependency may only
 * point from a method with a lower {@link #precedence()} to one with a higher precedence
 * ({@code post < get < put < patch < delete}).
 */
public enum ApiMethod {
    POST,
    GET,
    PUT,
    PATCH,
    DELETE;

    /**
     * @return the position of this method in the same-path precedence order.
     */
    public int precedence() {
        return ordinal();
    }

    /**
     * @return {@code true} if this method must come before {@code other} on the same path.
     */
    public boolean precedes(ApiMethod other) {
        return precedence() < other.precedence();
    }

    /**
     * Looks up a method by name, ignoring case. Methods outside the supported set
     * (HEAD, OPTIONS, TRACE) yield an empty result.
     */
    public static Optional<ApiMethod> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ApiMethod.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
