package com.graphdoc.core.model;

import java.util.List;

/**
 * Library a graph file depends on.
 */
public sealed interface Dependency permits PackageDependency, ExternalDependency {

    String name();

    List<String> nodeIds();

    /**
     * Name used as heading, including the version where known.
     *
     * @return full name
     */
    String fullName();
}
