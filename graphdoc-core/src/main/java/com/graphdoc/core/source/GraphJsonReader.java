package com.graphdoc.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.graphdoc.core.model.Annotation;
import com.graphdoc.core.model.Dependency;
import com.graphdoc.core.model.ExternalDependency;
import com.graphdoc.core.model.FileType;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.GraphPackage;
import com.graphdoc.core.model.Group;
import com.graphdoc.core.model.PackageDependency;
import com.graphdoc.core.model.PackageInfo;
import com.graphdoc.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads graph files ({@code .dyn}, {@code .dyf}) and package manifests ({@code pkg.json})
 * into the model using the Jackson tree model.
 *
 * <p>Node entries are merged with their view entry (name, position, flags) before being
 * handed to the first matching {@link NodeFactory}. View annotations with member nodes
 * become groups, the others free-standing annotations.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GraphJsonReader reader = new GraphJsonReader();
 * GraphFile script = reader.readGraph(Path.of("Scripts/01_Walls.dyn"));
 * GraphPackage pkg = reader.readPackage(Path.of("Packages/Tools/pkg.json"));
 * }</pre>
 */
public class GraphJsonReader {

    private static final Logger log = LoggerFactory.getLogger(GraphJsonReader.class);

    private final ObjectMapper objectMapper;
    private final List<NodeFactory> factories;

    public GraphJsonReader() {
        this(NodeFactory.defaults());
    }

    public GraphJsonReader(List<NodeFactory> factories) {
        this.objectMapper = new ObjectMapper();
        this.factories = List.copyOf(Objects.requireNonNull(factories, "factories must not be null"));
    }

    /**
     * Reads a script or custom node definition.
     *
     * @param file graph file
     * @return graph model
     * @throws IOException if the file cannot be read or parsed
     */
    public GraphFile readGraph(Path file) throws IOException {
        FileType type = fileType(file);
        JsonNode root = parseJson(file);

        List<GraphNode> nodes = readNodes(root);
        List<Group> groups = new ArrayList<>();
        List<Annotation> annotations = new ArrayList<>();
        for (JsonNode view : elements(root.path("View").path("Annotations"))) {
            List<String> memberIds = textList(view.get("Nodes"));
            if (memberIds.isEmpty()) {
                annotations.add(new Annotation(
                    extractText(view, "Id"),
                    extractText(view, "Title"),
                    extractText(view, "DescriptionText"),
                    view.path("Left").asDouble(),
                    view.path("Top").asDouble()));
            } else {
                groups.add(new Group(
                    extractText(view, "Id"),
                    extractText(view, "Title"),
                    extractText(view, "DescriptionText"),
                    memberIds,
                    extractText(view, "Background"),
                    view.path("Left").asDouble(),
                    view.path("Top").asDouble()));
            }
        }

        GraphFile graph = new GraphFile(
            file,
            type,
            extractText(root, "Uuid"),
            extractText(root, "Name"),
            extractText(root, "Description"),
            extractText(root.path("View").path("Dynamo"), "Version"),
            type == FileType.CUSTOM_NODE ? extractText(root, "Category") : null,
            nodes,
            groups,
            annotations,
            readDependencies(root),
            ids(root.get("Inputs")),
            ids(root.get("Outputs")));
        log.debug("Read {}: {} nodes, {} groups, {} annotations",
            file, nodes.size(), groups.size(), annotations.size());
        return graph;
    }

    /**
     * Reads a package manifest without its custom nodes.
     *
     * @param manifest {@code pkg.json} file
     * @return package model
     * @throws IOException if the file cannot be read or has no name
     */
    public GraphPackage readPackage(Path manifest) throws IOException {
        JsonNode root = parseJson(manifest);
        String name = extractText(root, "name");
        if (name == null || name.isBlank()) {
            throw new IOException("Package manifest without name: " + manifest);
        }
        PackageInfo info = new PackageInfo(
            extractText(root, "version"),
            extractText(root, "license"),
            extractText(root, "group"),
            textList(root.get("keywords")),
            extractText(root, "engine_version"),
            extractText(root, "site_url"),
            extractText(root, "repository_url"));
        return new GraphPackage(manifest, name, extractText(root, "description"), info, List.of());
    }

    private List<GraphNode> readNodes(JsonNode root) {
        Map<String, JsonNode> views = new HashMap<>();
        for (JsonNode view : elements(root.path("View").path("NodeViews"))) {
            String id = extractText(view, "Id");
            if (id != null) {
                views.put(id, view);
            }
        }

        List<GraphNode> nodes = new ArrayList<>();
        for (JsonNode content : elements(root.get("Nodes"))) {
            String id = extractText(content, "Id");
            if (id == null) {
                log.warn("Skipping node without id");
                continue;
            }
            ObjectNode merged = objectMapper.createObjectNode();
            if (content.isObject()) {
                merged.setAll((ObjectNode) content);
            }
            JsonNode view = views.get(id);
            if (view != null && view.isObject()) {
                merged.setAll((ObjectNode) view);
            }
            nodes.add(buildNode(merged));
        }
        return nodes;
    }

    private GraphNode buildNode(JsonNode node) {
        NodeFactory factory = factories.stream()
            .filter(candidate -> candidate.matches(node))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No node factory matches node " + extractText(node, "Id")));
        log.trace("Node {} built by {} factory", extractText(node, "Id"), factory.name());
        return new GraphNode(
            extractText(node, "Id"),
            extractText(node, "Name"),
            extractText(node, "Description"),
            node.path("X").asDouble(),
            node.path("Y").asDouble(),
            node.path("Excluded").asBoolean(false),
            node.path("ShowGeometry").asBoolean(false),
            node.path("IsSetAsInput").asBoolean(false),
            node.path("IsSetAsOutput").asBoolean(false),
            factory.details().apply(node));
    }

    private List<Dependency> readDependencies(JsonNode root) {
        List<Dependency> dependencies = new ArrayList<>();
        for (JsonNode dependency : elements(root.get("NodeLibraryDependencies"))) {
            String name = extractText(dependency, "Name");
            if (name == null) {
                continue;
            }
            String referenceType = extractText(dependency, "ReferenceType");
            List<String> nodeIds = textList(dependency.get("Nodes"));
            if ("Package".equals(referenceType)) {
                dependencies.add(new PackageDependency(name, extractText(dependency, "Version"), nodeIds));
            } else if ("External".equals(referenceType)) {
                dependencies.add(new ExternalDependency(name, nodeIds));
            } else {
                log.debug("Ignoring dependency {} of type {}", name, referenceType);
            }
        }
        return dependencies;
    }

    private JsonNode parseJson(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return objectMapper.readTree(content);
    }

    private static FileType fileType(Path file) {
        String extension = FileUtils.getExtension(file);
        for (FileType type : FileType.values()) {
            if (type.extension().equalsIgnoreCase(extension)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Not a graph file: " + file);
    }

    private static String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        JsonNode child = node.get(childName);
        if (child == null || child.isNull() || !child.isValueNode()) {
            return null;
        }
        return child.asText();
    }

    private static List<String> ids(JsonNode array) {
        List<String> ids = new ArrayList<>();
        for (JsonNode element : elements(array)) {
            String id = extractText(element, "Id");
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : elements(array)) {
            if (element.isValueNode() && !element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return node;
    }
}
