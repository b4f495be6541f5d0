package com.graphdoc.core.content;

import com.graphdoc.core.content.detail.NodeDetailRenderer;
import com.graphdoc.core.content.detail.NodeDetailRenderers;
import com.graphdoc.core.content.merge.ManualCleanup;
import com.graphdoc.core.markup.SectionMarkup;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Documentation of the current node: attribute table, kind-specific details and the
 * markup linked to the node.
 *
 * <p>Requires a {@link GraphNode} as current item and a {@link GraphFile} document.
 */
public class NodeDetailContent extends HeadingContent {

    private final NodeDetailRenderers renderers;
    private final boolean withDetails;
    private final ManualMode manualMode;
    private final Set<ManualCleanup> cleanups;

    /**
     * Creates full node documentation.
     *
     * @param renderers kind-specific renderers
     */
    public NodeDetailContent(NodeDetailRenderers renderers) {
        this(renderers, true, ManualMode.FALLBACK, Set.of());
    }

    /**
     * Creates node documentation.
     *
     * @param renderers kind-specific renderers
     * @param withDetails false to render the common attributes only
     * @param manualMode combination with recovered text
     * @param cleanups regenerated parts removed from recovered text
     */
    public NodeDetailContent(NodeDetailRenderers renderers, boolean withDetails, ManualMode manualMode,
                             Set<ManualCleanup> cleanups) {
        this.renderers = Objects.requireNonNull(renderers, "renderers must not be null");
        this.withDetails = withDetails;
        this.manualMode = manualMode;
        this.cleanups = Set.copyOf(cleanups);
    }

    @Override
    protected String headingText(RenderContext context) {
        return HeadingText.node(context.model(GraphFile.class), context.require(GraphNode.class));
    }

    @Override
    protected String defaultHeading() {
        return "Node";
    }

    @Override
    protected List<String> body(RenderContext context) {
        GraphNode node = context.require(GraphNode.class);
        ValueFormatter values = context.values();

        List<List<String>> rows = new ArrayList<>();
        if (node.description() != null && !node.description().isBlank()) {
            rows.add(List.of("Description", values.format(node.description())));
        }
        rows.add(List.of("Disabled", values.format(node.disabled())));
        rows.add(List.of("Geometry", values.format(node.showGeometry())));
        rows.add(List.of("Input", values.format(node.input())));
        rows.add(List.of("Output", values.format(node.output())));

        NodeDetailRenderer renderer = renderers.rendererFor(node);
        if (withDetails) {
            renderer.rows(node).forEach(row -> rows.add(List.of(row.key(), values.format(row.value()))));
        }

        List<String> lines = new ArrayList<>(context.exporter().asTable(null, rows));
        if (withDetails) {
            List<String> extra = renderer.extra(node, context);
            if (!extra.isEmpty()) {
                lines.add("");
                lines.addAll(extra);
            }
        }
        return lines;
    }

    @Override
    protected ManualMode manualMode() {
        return manualMode;
    }

    @Override
    protected Set<ManualCleanup> manualCleanups() {
        return cleanups;
    }

    @Override
    protected List<ContentNode> children(RenderContext context) {
        GraphNode node = context.require(GraphNode.class);
        Set<String> taken = new HashSet<>();
        List<ContentNode> children = new ArrayList<>();
        for (SectionMarkup markup : context.documentation().nodeMarkups(node.id())) {
            String title = markup.section().title();
            String heading = HeadingText.unique(HeadingText.canonical(markup.title(), title), title, taken);
            taken.add(heading);
            children.add(new MarkupContent(markup, heading));
        }
        return children;
    }
}
