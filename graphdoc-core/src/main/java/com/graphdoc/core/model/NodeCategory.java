package com.graphdoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Library category of a package and the custom nodes filed under it.
 *
 * @param name category name
 * @param customNodes custom nodes sorted by name
 */
public record NodeCategory(String name, List<GraphFile> customNodes) {
    public NodeCategory {
        Objects.requireNonNull(name, "name must not be null");
        customNodes = customNodes == null ? List.of() : List.copyOf(customNodes);
    }
}
