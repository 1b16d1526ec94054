package com.apichain.service.api;

import com.apichain.model.ApiOperation;
import com.apichain.model.ApiSpecification;
import com.apichain.model.OperationKey;
import com.apichain.model.ParameterCertainty;
import java.util.Map;

/**
 * Decides, per path parameter, whether a value can be invented from the specification or has to be
 * harvested from another operation's response.
 */
public interface ParameterCertaintyResolver {

    /**
     * @return one classification per path parameter of {@code operation}, in template order.
     */
    Map<String, ParameterCertainty> resolve(ApiOperation operation, ApiSpecification spec);

    /**
     * Classifies the path parameters of every operation in the specification.
     */
    Map<OperationKey, Map<String, ParameterCertainty>> resolveAll(ApiSpecification spec);
}
