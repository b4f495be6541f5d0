package com.graphdoc.core.model;

import java.util.Objects;

/**
 * Free-floating text label on the canvas.
 *
 * <p>An annotation never lists node ids. Labels that contain nodes are {@link Group}s.
 *
 * @param id annotation id
 * @param title label title
 * @param text label text, may embed a section marker
 * @param x canvas x position
 * @param y canvas y position
 */
public record Annotation(
    String id,
    String title,
    String text,
    double x,
    double y
) {
    public Annotation {
        Objects.requireNonNull(id, "id must not be null");
    }
}
