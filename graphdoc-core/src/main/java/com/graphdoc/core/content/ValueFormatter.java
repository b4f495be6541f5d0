package com.graphdoc.core.content;

import java.util.Objects;

/**
 * Formats model values for table cells.
 *
 * @param trueValue text for {@code true}
 * @param falseValue text for {@code false}
 * @param defaultValue text for missing values
 */
public record ValueFormatter(String trueValue, String falseValue, String defaultValue) {

    public ValueFormatter {
        Objects.requireNonNull(trueValue, "trueValue must not be null");
        Objects.requireNonNull(falseValue, "falseValue must not be null");
        Objects.requireNonNull(defaultValue, "defaultValue must not be null");
    }

    public static ValueFormatter defaults() {
        return new ValueFormatter("Yes", "No", "n/a");
    }

    public String format(boolean value) {
        return value ? trueValue : falseValue;
    }

    /**
     * Formats text, substituting the default for null or blank values.
     *
     * @param value value to format
     * @return trimmed value or default
     */
    public String format(String value) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }
}
