package com.apichain.model;

public enum FailureReason {
    UNRESOLVED_PARAMETER,
    UNEXPECTED_STATUS,
    TIMEOUT,
    TRANSPORT_ERROR
}
