package com.graphdoc.core.export;

/**
 * Line span of a rendered table.
 *
 * @param start index of the first table line
 * @param end index after the last table line
 */
public record TableRange(int start, int end) {
    public TableRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid table range: " + start + ".." + end);
        }
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    public int size() {
        return end - start;
    }
}
