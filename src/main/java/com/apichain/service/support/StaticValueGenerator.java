package com.apichain.service.support;

import com.apichain.model.schema.ScalarSchemaNode;
import com.apichain.model.schema.SchemaNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Invents a plausible value for a parameter or body field from its schema and name alone.
 * Values are deterministic so that repeated runs send identical requests.
 */
public final class StaticValueGenerator {

    /**
     * Substituted for a path parameter that has neither a bound nor an inventable value.
     */
    public static final String UNRESOLVED = "%not-sure%";

    private static final Pattern EXAMPLE_HINT = Pattern.compile("example:\\s*([^\\s,;)]+)", Pattern.CASE_INSENSITIVE);

    // tried in order against a schema pattern the invented value does not satisfy
    private static final List<String> PATTERN_CANDIDATES = List.of(
            "1", "001", "100000", "a", "abc", "A", "ABC", "AB", "a1", "A1", "AB12", "ABC-123", "abc-123", "abc_123", "default");

    private StaticValueGenerator() {
    }

    /**
     * @param name   the parameter or field name.
     * @param schema the dereferenced schema, or {@code null}.
     */
    public static Object generate(String name, SchemaNode schema) {
        ScalarSchemaNode scalar = schema instanceof ScalarSchemaNode s ? s : null;
        if (scalar != null) {
            if (!scalar.enumValues().isEmpty() && scalar.enumValues().get(0) != null) {
                return scalar.enumValues().get(0);
            }
            if (scalar.example() != null) {
                return scalar.example();
            }
            Object invented = invent(name, scalar);
            return scalar.pattern() == null || scalar.pattern().isBlank() ? invented : conform(invented, scalar.pattern());
        }
        return invent(name, null);
    }

    private static Object invent(String name, ScalarSchemaNode scalar) {
        if (scalar != null) {
            Object formatted = forFormat(scalar.format(), name);
            if (formatted != null) {
                return formatted;
            }
            if (scalar.minimum() != null) {
                return numeric(scalar, scalar.minimum());
            }
            if (scalar.description() != null) {
                Matcher hint = EXAMPLE_HINT.matcher(scalar.description());
                if (hint.find()) {
                    return hint.group(1);
                }
            }
        }

        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.contains("uuid") || lower.contains("guid")) {
            return forFormat("uuid", name);
        }
        if (lower.contains("year")) {
            return 2024;
        }
        if (lower.contains("month") || lower.contains("day")) {
            return 1;
        }
        if (lower.contains("date")) {
            return "2024-01-01";
        }
        if (lower.contains("time")) {
            return "00:00:00";
        }
        if (scalar != null && scalar.isNumeric()) {
            return 1;
        }
        if (scalar != null && "boolean".equals(scalar.type())) {
            return true;
        }
        return lower.contains("id") ? "1" : "default";
    }

    /**
     * Returns {@code value} when it satisfies the pattern, otherwise the first fixed candidate that does.
     * With no matching candidate the value is returned unchanged; such parameters need a seed binding or
     * an extraction.
     */
    static Object conform(Object value, String pattern) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            return value;
        }
        if (compiled.matcher(String.valueOf(value)).find()) {
            return value;
        }
        for (String candidate : PATTERN_CANDIDATES) {
            if (compiled.matcher(candidate).find()) {
                return candidate;
            }
        }
        return value;
    }

    private static Object forFormat(String format, String name) {
        if (format == null) {
            return null;
        }
        return switch (format) {
            case "date" -> "2024-01-01";
            case "date-time" -> "2024-01-01T00:00:00Z";
            case "email" -> "user@example.com";
            case "uuid" -> UUID.nameUUIDFromBytes(String.valueOf(name).getBytes(StandardCharsets.UTF_8)).toString();
            default -> null;
        };
    }

    private static Object numeric(ScalarSchemaNode scalar, BigDecimal value) {
        if ("integer".equals(scalar.type())) {
            return value.setScale(0, RoundingMode.CEILING).longValue();
        }
        return value;
    }
}
