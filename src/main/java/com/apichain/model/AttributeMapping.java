package com.apichain.model;

/**
 * One coupling between a producer's output attribute and a consumer's input attribute.
 */
public record AttributeMapping(String sourceAttribute, String targetAttribute) {
}
