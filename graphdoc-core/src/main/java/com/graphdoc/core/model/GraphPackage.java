package com.graphdoc.core.model;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Node package with its custom node definitions.
 *
 * @param path path of the package manifest
 * @param name package name
 * @param description optional description
 * @param info manifest metadata
 * @param customNodes custom node definitions shipped with the package
 */
public record GraphPackage(
    Path path,
    String name,
    String description,
    PackageInfo info,
    List<GraphFile> customNodes
) {
    /**
     * Category used for custom nodes without one.
     */
    public static final String UNCATEGORIZED = "Uncategorized";

    /**
     * Compact constructor with validation.
     */
    public GraphPackage {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (info == null) {
            info = new PackageInfo(null, null, null, List.of(), null, null, null);
        }
        customNodes = customNodes == null ? List.of() : List.copyOf(customNodes);
    }

    /**
     * Returns a copy of this package with the given custom nodes.
     *
     * @param nodes custom node definitions
     * @return new package
     */
    public GraphPackage withCustomNodes(List<GraphFile> nodes) {
        return new GraphPackage(path, name, description, info, nodes);
    }

    /**
     * Package version, never null.
     *
     * @return version or empty string
     */
    public String version() {
        return info.version() == null ? "" : info.version();
    }

    /**
     * Name and version, unique across packages.
     *
     * @return full name
     */
    public String fullName() {
        return version().isBlank() ? name : name + " [" + version() + "]";
    }

    /**
     * Custom nodes grouped by category, categories and nodes sorted by name.
     *
     * @return categories in name order
     */
    public List<NodeCategory> categories() {
        Map<String, List<GraphFile>> byCategory = customNodes.stream()
            .sorted(Comparator.comparing(GraphFile::name, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(file -> file.path().toString()))
            .collect(Collectors.groupingBy(
                file -> file.category() == null || file.category().isBlank() ? UNCATEGORIZED : file.category().trim(),
                TreeMap::new,
                Collectors.toList()));
        return byCategory.entrySet().stream()
            .map(entry -> new NodeCategory(entry.getKey(), entry.getValue()))
            .toList();
    }
}
