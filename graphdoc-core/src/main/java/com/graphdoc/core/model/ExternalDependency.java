package com.graphdoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Dependency on an external library, e.g. a referenced assembly.
 *
 * @param name library name
 * @param nodeIds ids of the nodes using the library
 */
public record ExternalDependency(
    String name,
    List<String> nodeIds
) implements Dependency {
    public ExternalDependency {
        Objects.requireNonNull(name, "name must not be null");
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    @Override
    public String fullName() {
        return name;
    }
}
