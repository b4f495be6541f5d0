package com.graphdoc.core.model;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed graph file: a script or a custom node definition.
 *
 * <p>Built once by the ingestion layer and never mutated afterwards. Node ids are unique
 * within one file.
 *
 * @param path source path
 * @param type script or custom node
 * @param uuid file uuid
 * @param name file name as stored in the graph
 * @param description optional description
 * @param hostVersion version of the host application that saved the file
 * @param category library category (custom nodes only)
 * @param nodes nodes in file order
 * @param groups groups in file order
 * @param annotations annotations in file order
 * @param dependencies package and external dependencies
 * @param inputIds ids of the nodes listed as graph inputs
 * @param outputIds ids of the nodes listed as graph outputs
 */
public record GraphFile(
    Path path,
    FileType type,
    String uuid,
    String name,
    String description,
    String hostVersion,
    String category,
    List<GraphNode> nodes,
    List<Group> groups,
    List<Annotation> annotations,
    List<Dependency> dependencies,
    List<String> inputIds,
    List<String> outputIds
) {
    private static final Comparator<GraphNode> BY_NAME_AND_ID =
        Comparator.comparing(GraphNode::name).thenComparing(GraphNode::id);

    /**
     * Compact constructor with validation.
     */
    public GraphFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(type, "type must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        groups = groups == null ? List.of() : List.copyOf(groups);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        inputIds = inputIds == null ? List.of() : List.copyOf(inputIds);
        outputIds = outputIds == null ? List.of() : List.copyOf(outputIds);
    }

    /**
     * Returns the nodes of the given kinds sorted by name, then id.
     *
     * @param kinds node kinds to select
     * @return sorted nodes
     */
    public List<GraphNode> nodesOf(Collection<NodeKind> kinds) {
        Set<NodeKind> selected = kinds.isEmpty() ? Set.of() : EnumSet.copyOf(kinds);
        return nodes.stream()
            .filter(node -> selected.contains(node.kind()))
            .sorted(BY_NAME_AND_ID)
            .toList();
    }

    /**
     * Returns the nodes of one kind sorted by name, then id.
     *
     * @param kind node kind
     * @return sorted nodes
     */
    public List<GraphNode> nodesOf(NodeKind kind) {
        return nodesOf(List.of(kind));
    }

    /**
     * Looks up a node by id.
     *
     * @param nodeId node id
     * @return the node, if part of this file
     */
    public Optional<GraphNode> nodeById(String nodeId) {
        return nodes.stream()
            .filter(node -> node.id().equals(nodeId))
            .findFirst();
    }

    /**
     * Returns the dependencies of a type sorted by name.
     *
     * @param dependencyType dependency class
     * @param <T> dependency type
     * @return sorted dependencies
     */
    public <T extends Dependency> List<T> dependenciesOf(Class<T> dependencyType) {
        return dependencies.stream()
            .filter(dependencyType::isInstance)
            .map(dependencyType::cast)
            .sorted(Comparator.comparing(Dependency::name))
            .toList();
    }

    /**
     * Returns whether a node is a graph input.
     *
     * @param node node of this file
     * @return true if flagged as input or listed in the inputs
     */
    public boolean isInput(GraphNode node) {
        return node.input() || inputIds.contains(node.id());
    }

    /**
     * Returns whether a node is a graph output.
     *
     * @param node node of this file
     * @return true if flagged as output or listed in the outputs
     */
    public boolean isOutput(GraphNode node) {
        return node.output() || outputIds.contains(node.id());
    }

    /**
     * File name without extension.
     *
     * @return stem of the source path
     */
    public String fileStem() {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
