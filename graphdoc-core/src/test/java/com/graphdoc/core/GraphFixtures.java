package com.graphdoc.core;

import com.graphdoc.core.model.Annotation;
import com.graphdoc.core.model.Dependency;
import com.graphdoc.core.model.FileType;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.Group;
import com.graphdoc.core.model.NodeDetails;

import java.nio.file.Path;
import java.util.List;

/**
 * Small model builders shared by the tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
        // Utility class
    }

    public static GraphNode node(String id, String name, double x, double y) {
        return new GraphNode(id, name, null, x, y, false, false, false, false, new NodeDetails.General());
    }

    public static GraphNode node(String id, String name, NodeDetails details) {
        return new GraphNode(id, name, null, 0, 0, false, false, false, false, details);
    }

    public static GraphNode inputNode(String id, String name, NodeDetails details) {
        return new GraphNode(id, name, null, 0, 0, false, false, true, false, details);
    }

    public static GraphNode python(String id, String name, String code) {
        return node(id, name, new NodeDetails.PythonScript(code, "CPython3"));
    }

    public static Annotation annotation(String id, String text, double x, double y) {
        return new Annotation(id, text, null, x, y);
    }

    public static Group group(String id, String title, String text, List<String> memberIds) {
        return new Group(id, title, text, memberIds, "#FFC1D676", 0, 0);
    }

    public static GraphFile script(Path path, List<GraphNode> nodes) {
        return script(path, nodes, List.of(), List.of(), List.of());
    }

    public static GraphFile script(Path path, List<GraphNode> nodes, List<Group> groups,
                                   List<Annotation> annotations, List<Dependency> dependencies) {
        return new GraphFile(path, FileType.SCRIPT, "3c9d0464-8643-5ffe-96e5-ab1769818209",
            "Walls", "Creates walls along model lines", "2.13.1.3887", null,
            nodes, groups, annotations, dependencies, List.of(), List.of());
    }

    public static GraphFile customNode(Path path, String name, String category, List<GraphNode> nodes) {
        return new GraphFile(path, FileType.CUSTOM_NODE, "f5e0b9a1-4d6c-4b7e-9e2f-1a2b3c4d5e6f",
            name, "Custom node " + name, "2.13.1.3887", category,
            nodes, List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
