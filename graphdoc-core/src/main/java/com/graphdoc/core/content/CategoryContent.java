package com.graphdoc.core.content;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.NodeCategory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Current package category with links to the documents of its custom nodes.
 */
public class CategoryContent extends HeadingContent {

    private final Function<GraphFile, Path> destinations;

    /**
     * Creates category content.
     *
     * @param destinations document path of a custom node
     */
    public CategoryContent(Function<GraphFile, Path> destinations) {
        this.destinations = Objects.requireNonNull(destinations, "destinations must not be null");
    }

    @Override
    protected String headingText(RenderContext context) {
        return context.require(NodeCategory.class).name();
    }

    @Override
    protected List<String> body(RenderContext context) {
        NodeCategory category = context.require(NodeCategory.class);
        Path document = context.docFile().destination();
        List<String> links = category.customNodes().stream()
            .map(node -> context.exporter().fileLink(
                destinations.apply(node), document, HeadingText.displayName(node.name(), node.fileStem())))
            .toList();
        return context.exporter().asList(links);
    }
}
