package com.graphdoc.core.content;

import com.graphdoc.core.model.Dependency;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.PackageDependency;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Documentation of the current dependency and the nodes using it.
 */
public class DependencyContent extends HeadingContent {

    @Override
    protected String headingText(RenderContext context) {
        return context.require(Dependency.class).fullName();
    }

    @Override
    protected String defaultHeading() {
        return "Dependency";
    }

    @Override
    protected List<String> body(RenderContext context) {
        Dependency dependency = context.require(Dependency.class);
        GraphFile file = context.model(GraphFile.class);
        ValueFormatter values = context.values();

        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of("Name", values.format(dependency.name())));
        if (dependency instanceof PackageDependency packageDependency) {
            rows.add(List.of("Version", values.format(packageDependency.version())));
        }
        rows.add(List.of("Nodes", String.valueOf(dependency.nodeIds().size())));

        List<String> lines = new ArrayList<>(context.exporter().asTable(null, rows));
        List<String> nodeNames = dependency.nodeIds().stream()
            .map(file::nodeById)
            .flatMap(Optional::stream)
            .map(node -> HeadingText.node(file, node))
            .distinct()
            .sorted()
            .toList();
        if (!nodeNames.isEmpty()) {
            lines.add("");
            lines.addAll(context.exporter().asList(nodeNames));
        }
        return lines;
    }
}
