package com.apichain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * The certainty classification of one path parameter of one operation.
 *
 * @param dependencyEndpoints for uncertain parameters, the operations whose outputs can supply the value,
 *                            closest path first; empty for certain parameters or when nothing produces it.
 */
public record ParameterCertainty(String parameterName,
                                 Certainty certainty,
                                 CertaintyBasis basis,
                                 List<OperationKey> dependencyEndpoints) {

    public ParameterCertainty {
        dependencyEndpoints = dependencyEndpoints == null ? List.of() : List.copyOf(dependencyEndpoints);
    }

    public static ParameterCertainty certain(String parameterName, CertaintyBasis basis) {
        return new ParameterCertainty(parameterName, Certainty.CERTAIN, basis, List.of());
    }

    public static ParameterCertainty uncertain(String parameterName, List<OperationKey> dependencyEndpoints) {
        return new ParameterCertainty(parameterName, Certainty.UNCERTAIN, CertaintyBasis.NONE, dependencyEndpoints);
    }

    @JsonIgnore
    public boolean isCertain() {
        return certainty == Certainty.CERTAIN;
    }
}
