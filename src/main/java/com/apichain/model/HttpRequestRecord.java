package com.apichain.model;

import java.util.Map;

/**
 * The request a step sent, or would have sent had its parameters resolved.
 */
public record HttpRequestRecord(String method, String url, Map<String, String> headers, Object body) {
}
