package com.apichain.model;

public record HttpResponseRecord(int statusCode, String contentType, String body) {
}
