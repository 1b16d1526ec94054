package com.apichain.service.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls attribute values out of a response body for later steps.
 */
@Slf4j
public final class ResponseHarvester {

    private ResponseHarvester() {
    }

    /**
     * Scalar fields at the top level and one level down. A top-level field wins over a nested field of
     * the same name. When the body (or a nested field) is an array, its first element is used.
     */
    public static Map<String, Object> harvest(JsonNode body) {
        Map<String, Object> values = new LinkedHashMap<>();
        JsonNode root = firstIfArray(body);
        if (root == null || !root.isObject()) {
            return values;
        }
        root.fields().forEachRemaining(field -> {
            JsonNode nested = firstIfArray(field.getValue());
            if (nested != null && nested.isObject()) {
                putScalars(nested, values);
            }
        });
        putScalars(root, values);
        return values;
    }

    /**
     * Evaluates each JsonPath against the raw body. Paths that do not match are skipped.
     *
     * @param extractions JsonPath expressions keyed by the attribute name to bind.
     */
    public static Map<String, Object> extract(String rawBody, Map<String, String> extractions) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (rawBody == null || rawBody.isBlank() || extractions.isEmpty()) {
            return values;
        }
        extractions.forEach((name, path) -> {
            try {
                Object value = JsonPath.read(rawBody, path);
                if (value instanceof Iterable<?> iterable) {
                    Iterator<?> iterator = iterable.iterator();
                    value = iterator.hasNext() ? iterator.next() : null;
                }
                if (value != null) {
                    values.put(name, value);
                }
            } catch (PathNotFoundException e) {
                log.debug("  JsonPath '{}' for '{}' matched nothing", path, name);
            } catch (RuntimeException e) {
                log.warn("Could not evaluate JsonPath '{}' for '{}': {}", path, name, e.getMessage());
            }
        });
        return values;
    }

    private static JsonNode firstIfArray(JsonNode node) {
        if (node != null && node.isArray()) {
            return node.isEmpty() ? null : node.get(0);
        }
        return node;
    }

    private static void putScalars(JsonNode object, Map<String, Object> values) {
        object.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isValueNode() && !value.isNull()) {
                values.put(field.getKey(), toJava(value));
            }
        });
    }

    private static Object toJava(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? value.longValue() : value.bigIntegerValue();
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asText();
    }
}
