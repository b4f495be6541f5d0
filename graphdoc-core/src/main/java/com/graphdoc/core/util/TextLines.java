package com.graphdoc.core.util;

import java.util.Arrays;
import java.util.List;

/**
 * Helpers for line lists.
 */
public final class TextLines {

    private TextLines() {
        // Utility class
    }

    /**
     * Splits text on any line break, keeping empty lines.
     *
     * @param text text, may be null
     * @return lines, empty for null or empty text
     */
    public static List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\\R", -1));
    }

    /**
     * Removes blank lines at both ends.
     *
     * @param lines lines to trim
     * @return trimmed view
     */
    public static List<String> stripBlank(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        return List.copyOf(lines.subList(start, end));
    }

    /**
     * Returns whether all lines are blank.
     *
     * @param lines lines to test
     * @return true for an empty or blank-only list
     */
    public static boolean isBlank(List<String> lines) {
        return lines.stream().allMatch(String::isBlank);
    }
}
