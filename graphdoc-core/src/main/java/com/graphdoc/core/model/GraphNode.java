package com.graphdoc.core.model;

import java.util.Objects;

/**
 * A node of a visual program.
 *
 * @param id unique id within the file, the only join key between model parts
 * @param name display name shown on the canvas
 * @param description optional description
 * @param x canvas x position
 * @param y canvas y position
 * @param disabled true if the node is excluded from execution
 * @param showGeometry true if the node previews geometry
 * @param input true if the node is flagged as graph input
 * @param output true if the node is flagged as graph output
 * @param details kind-specific payload
 */
public record GraphNode(
    String id,
    String name,
    String description,
    double x,
    double y,
    boolean disabled,
    boolean showGeometry,
    boolean input,
    boolean output,
    NodeDetails details
) {
    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        if (name == null) {
            name = "";
        }
        if (details == null) {
            details = new NodeDetails.General();
        }
    }

    /**
     * Returns the discriminant of this node.
     *
     * @return node kind
     */
    public NodeKind kind() {
        return details.kind();
    }

    /**
     * Euclidean distance between this node and a canvas position.
     *
     * @param otherX x position
     * @param otherY y position
     * @return distance
     */
    public double distanceTo(double otherX, double otherY) {
        return Math.hypot(x - otherX, y - otherY);
    }
}
