package com.apichain.exception;

/**
 * The root of all application errors: failures to load a specification, persist state,
 * or configure a sequence run.
 */
public class ApiChainException extends RuntimeException {

    public ApiChainException(String message) {
        super(message);
    }

    /**
     * @param message the detail message.
     * @param cause   the underlying failure; {@code null} if unknown.
     */
    public ApiChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
