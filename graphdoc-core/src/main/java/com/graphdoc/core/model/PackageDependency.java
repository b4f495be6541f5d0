package com.graphdoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Dependency on a node package.
 *
 * @param name package name
 * @param version package version
 * @param nodeIds ids of the nodes using the package
 */
public record PackageDependency(
    String name,
    String version,
    List<String> nodeIds
) implements Dependency {
    public PackageDependency {
        Objects.requireNonNull(name, "name must not be null");
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    @Override
    public String fullName() {
        return version == null || version.isBlank() ? name : name + " [" + version + "]";
    }
}
