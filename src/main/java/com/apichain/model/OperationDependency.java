package com.apichain.model;

import java.util.List;

/**
 * The exported form of a dependency edge, addressed by operation signature.
 */
public record OperationDependency(OperationKey source,
                                  OperationKey target,
                                  String reason,
                                  List<AttributeMapping> dataMapping) {
}
