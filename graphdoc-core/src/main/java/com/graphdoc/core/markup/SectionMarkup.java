package com.graphdoc.core.markup;

import java.util.List;
import java.util.Objects;

/**
 * Section text parsed from an annotation or group.
 *
 * @param section addressed section
 * @param title text after the marker, without the order hint
 * @param order optional order hint, null when absent
 * @param body lines after the marker line, blank-trimmed
 * @param sourceId id of the annotation or group the text came from
 */
public record SectionMarkup(
    Section section,
    String title,
    Integer order,
    List<String> body,
    String sourceId
) {
    public SectionMarkup {
        Objects.requireNonNull(section, "section must not be null");
        title = title == null ? "" : title;
        body = body == null ? List.of() : List.copyOf(body);
    }

    public boolean hasOrder() {
        return order != null;
    }
}
