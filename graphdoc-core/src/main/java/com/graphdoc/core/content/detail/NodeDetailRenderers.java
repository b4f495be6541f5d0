package com.graphdoc.core.content.detail;

import com.graphdoc.core.model.GraphNode;

import java.util.List;
import java.util.Objects;

/**
 * Priority-ordered list of node detail renderers.
 *
 * <p>The first renderer supporting a node wins. Order matters: python scripts carry code
 * too, so the python renderer has to precede the generic code renderer, and the catch-all
 * renderer has to be last.
 */
public final class NodeDetailRenderers {

    /**
     * Spaces replacing a tab in code blocks.
     */
    public static final int DEFAULT_INDENT = 4;

    private final List<NodeDetailRenderer> renderers;

    public NodeDetailRenderers(List<NodeDetailRenderer> renderers) {
        if (renderers == null || renderers.isEmpty()) {
            throw new IllegalArgumentException("At least one renderer is required");
        }
        this.renderers = List.copyOf(renderers);
    }

    /**
     * Default renderer list.
     *
     * @return renderers in priority order
     */
    public static NodeDetailRenderers defaults() {
        return new NodeDetailRenderers(List.of(
            new PythonScriptRenderer(DEFAULT_INDENT),
            new CodeRenderer(DEFAULT_INDENT),
            new PathInputRenderer(),
            new ValueInputRenderer(),
            new CustomReferenceRenderer(),
            new GeneralNodeRenderer()
        ));
    }

    public List<NodeDetailRenderer> renderers() {
        return renderers;
    }

    /**
     * Selects the renderer of a node.
     *
     * @param node node to render
     * @return first supporting renderer
     * @throws IllegalStateException if no renderer supports the node
     */
    public NodeDetailRenderer rendererFor(GraphNode node) {
        Objects.requireNonNull(node, "node must not be null");
        for (NodeDetailRenderer renderer : renderers) {
            if (renderer.supports(node)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No renderer for node " + node.id() + " of kind " + node.kind());
    }
}
