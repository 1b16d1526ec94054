package com.apichain.exception;

/**
 * A sequence run cannot start: the base URL is invalid, a required credential is missing,
 * or the sequence names an operation the specification lacks.
 */
public class InvalidExecutionConfigurationException extends ApiChainException {

    public InvalidExecutionConfigurationException(String message) {
        super(message);
    }
}
