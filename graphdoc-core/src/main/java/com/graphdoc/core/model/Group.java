package com.graphdoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Labelled container of nodes.
 *
 * @param id group id
 * @param title group title
 * @param text group description, may embed a section marker
 * @param memberIds ids of the contained nodes
 * @param color background color
 * @param x canvas x position
 * @param y canvas y position
 */
public record Group(
    String id,
    String title,
    String text,
    List<String> memberIds,
    String color,
    double x,
    double y
) {
    public Group {
        Objects.requireNonNull(id, "id must not be null");
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
