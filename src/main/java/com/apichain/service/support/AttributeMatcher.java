package com.apichain.service.support;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Name matching between a produced attribute and a consumed parameter, looser than string equality.
 * <p>
 * Two names match when they are equal, when they are equal after lower-casing and dropping
 * {@code _} and {@code -}, or when the producer emits a bare {@code id} and the consumer asks for
 * {@code <stem>Id} where the producer's resource (its last literal path segment, singularized)
 * corresponds to the stem. So {@code POST /items} producing {@code id} matches {@code itemId}.
 */
public final class AttributeMatcher {

    private AttributeMatcher() {
    }

    public static String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }

    public static boolean matches(String produced, String consumed, String producerPath) {
        if (produced == null || consumed == null) {
            return false;
        }
        if (produced.equals(consumed)) {
            return true;
        }
        String normalizedProduced = normalize(produced);
        String normalizedConsumed = normalize(consumed);
        if (normalizedProduced.equals(normalizedConsumed)) {
            return true;
        }
        if (!"id".equals(normalizedProduced) || !normalizedConsumed.endsWith("id") || normalizedConsumed.length() <= 2) {
            return false;
        }
        String stem = normalizedConsumed.substring(0, normalizedConsumed.length() - 2);
        String resource = singularize(normalize(lastLiteralSegment(producerPath)));
        return !resource.isEmpty() && (resource.startsWith(stem) || stem.startsWith(resource));
    }

    /**
     * The last path segment that is not a template variable, or an empty string if there is none.
     */
    public static String lastLiteralSegment(String path) {
        if (path == null) {
            return "";
        }
        List<String> segments = literalSegments(path);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    public static List<String> literalSegments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty() && !s.startsWith("{"))
                .toList();
    }

    /**
     * Counts the leading path segments (literal or template) two paths share.
     */
    public static int commonPrefixLength(String left, String right) {
        String[] a = left.split("/");
        String[] b = right.split("/");
        int count = 0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            if (!a[i].equals(b[i])) {
                break;
            }
            if (!a[i].isEmpty()) {
                count++;
            }
        }
        return count;
    }

    static String singularize(String word) {
        if (word.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("ses") || word.endsWith("xes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
