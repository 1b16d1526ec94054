package com.apichain.service.impl;

import com.apichain.exception.SchemaResolutionException;
import com.apichain.model.ApiOperation;
import com.apichain.model.ApiParameter;
import com.apichain.model.ApiSpecification;
import com.apichain.model.CertaintyBasis;
import com.apichain.model.OperationKey;
import com.apichain.model.ParameterCertainty;
import com.apichain.model.schema.ScalarSchemaNode;
import com.apichain.model.schema.SchemaNode;
import com.apichain.service.api.ParameterCertaintyResolver;
import com.apichain.service.support.AttributeMatcher;
import com.apichain.service.support.SchemaResolver;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ParameterCertaintyResolverImpl implements ParameterCertaintyResolver {

    private static final Set<String> KNOWN_FORMATS = Set.of("date", "date-time", "email", "uuid");
    private static final List<String> DESCRIPTION_HINTS = List.of(
            "valid values are", "must be one of", "format:", "example:", "yyyy-mm-dd", "iso 8601", "iso-8601");
    private static final List<String> NAME_TOKENS = List.of("year", "month", "day", "date", "time", "uuid", "guid");
    private static final BigDecimal MAX_RANGE = BigDecimal.valueOf(100);

    @Override
    public Map<String, ParameterCertainty> resolve(ApiOperation operation, ApiSpecification spec) {
        SchemaResolver resolver = SchemaResolver.of(spec);
        Map<String, ParameterCertainty> result = new LinkedHashMap<>();
        for (String name : operation.pathParameterNames()) {
            Optional<ApiParameter> parameter = operation.findParameter(name, ApiParameter.IN_PATH);
            CertaintyBasis basis = classify(name, parameter.orElse(null), resolver);
            ParameterCertainty certainty = basis == CertaintyBasis.NONE
                    ? ParameterCertainty.uncertain(name, dependencyEndpoints(operation, name, spec))
                    : ParameterCertainty.certain(name, basis);
            log.debug("  {} '{}': {} ({})", operation.signature(), name, certainty.certainty(), basis);
            result.put(name, certainty);
        }
        return result;
    }

    @Override
    public Map<OperationKey, Map<String, ParameterCertainty>> resolveAll(ApiSpecification spec) {
        Map<OperationKey, Map<String, ParameterCertainty>> all = new LinkedHashMap<>();
        spec.getOperations().forEach(op -> all.put(op.key(), resolve(op, spec)));
        return all;
    }

    private CertaintyBasis classify(String name, ApiParameter parameter, SchemaResolver resolver) {
        SchemaNode schema = parameter == null ? null : dereference(parameter.getSchema(), resolver);
        String description = parameter == null ? null : parameter.getDescription();

        if (schema instanceof ScalarSchemaNode scalar) {
            if (!scalar.enumValues().isEmpty()) {
                return CertaintyBasis.ENUM;
            }
            if (scalar.format() != null && KNOWN_FORMATS.contains(scalar.format())) {
                return CertaintyBasis.FORMAT;
            }
            if (scalar.pattern() != null && !scalar.pattern().isBlank()) {
                return CertaintyBasis.PATTERN;
            }
            if (scalar.minimum() != null && scalar.maximum() != null
                    && scalar.maximum().subtract(scalar.minimum()).compareTo(MAX_RANGE) <= 0) {
                return CertaintyBasis.BOUNDED_RANGE;
            }
            if (description == null) {
                description = scalar.description();
            } else if (scalar.description() != null) {
                description = description + " " + scalar.description();
            }
        }
        if (description != null) {
            String lower = description.toLowerCase(Locale.ROOT);
            if (DESCRIPTION_HINTS.stream().anyMatch(lower::contains)) {
                return CertaintyBasis.DESCRIPTION_HINT;
            }
        }
        if (nameTokens(name).stream().anyMatch(token -> NAME_TOKENS.stream().anyMatch(token::startsWith))) {
            return CertaintyBasis.NAME_PATTERN;
        }
        return CertaintyBasis.NONE;
    }

    /**
     * Other operations producing a value for {@code name}, closest path first, then in declaration order.
     */
    private List<OperationKey> dependencyEndpoints(ApiOperation operation, String name, ApiSpecification spec) {
        List<ApiOperation> operations = spec.getOperations();
        return IntStream.range(0, operations.size())
                .filter(i -> !operations.get(i).key().equals(operation.key()))
                .filter(i -> operations.get(i).getOutputAttributes().stream()
                        .anyMatch(output -> AttributeMatcher.matches(output, name, operations.get(i).getPath())))
                .boxed()
                .sorted(Comparator.<Integer>comparingInt(
                                i -> -AttributeMatcher.commonPrefixLength(operations.get(i).getPath(), operation.getPath()))
                        .thenComparingInt(i -> i))
                .map(i -> operations.get(i).key())
                .toList();
    }

    /**
     * Splits camelCase, snake_case and kebab-case names into lower-case words.
     */
    static List<String> nameTokens(String name) {
        List<String> tokens = new ArrayList<>();
        for (String part : name.split("[_\\-\\s]+|(?<=[a-z0-9])(?=[A-Z])")) {
            if (!part.isEmpty()) {
                tokens.add(part.toLowerCase(Locale.ROOT));
            }
        }
        return tokens;
    }

    private SchemaNode dereference(SchemaNode schema, SchemaResolver resolver) {
        if (schema == null) {
            return null;
        }
        try {
            return resolver.dereference(schema);
        } catch (SchemaResolutionException e) {
            log.warn("{}; classifying the parameter by name and description only", e.getMessage());
            return null;
        }
    }
}
