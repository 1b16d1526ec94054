package com.apichain.service.support;

import java.util.Locale;

/**
 * An inclusive range of acceptable HTTP status codes, parsed from {@code "2xx"}, {@code "404"} or {@code "200-299"}.
 */
public record ExpectedStatus(int low, int high) {

    public static final ExpectedStatus SUCCESS = new ExpectedStatus(200, 299);

    /**
     * @throws IllegalArgumentException if the spec is not one of the accepted forms.
     */
    public static ExpectedStatus parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return SUCCESS;
        }
        String value = spec.trim().toLowerCase(Locale.ROOT);
        try {
            if (value.matches("[1-5]xx")) {
                int base = (value.charAt(0) - '0') * 100;
                return new ExpectedStatus(base, base + 99);
            }
            int dash = value.indexOf('-');
            if (dash > 0) {
                int low = Integer.parseInt(value.substring(0, dash).trim());
                int high = Integer.parseInt(value.substring(dash + 1).trim());
                if (low > high) {
                    throw new IllegalArgumentException("Empty status range: '" + spec + "'");
                }
                return new ExpectedStatus(low, high);
            }
            int code = Integer.parseInt(value);
            return new ExpectedStatus(code, code);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid expected status: '" + spec + "'", e);
        }
    }

    public boolean matches(int statusCode) {
        return statusCode >= low && statusCode <= high;
    }

    @Override
    public String toString() {
        return low == high ? String.valueOf(low) : low + "-" + high;
    }
}
