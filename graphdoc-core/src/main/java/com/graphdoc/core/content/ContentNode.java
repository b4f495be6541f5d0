package com.graphdoc.core.content;

import java.util.List;
import java.util.Optional;

/**
 * Unit of a rendered document: a heading with body and children.
 *
 * <p>Trees are built fresh for every document and every run. A node renders top-down and
 * reads its previous text through the {@link RenderContext}.
 */
public abstract class ContentNode {

    /**
     * Returns whether this node or one of its children has something to render.
     *
     * @param context render context
     * @return false if the whole subtree is suppressed
     */
    public abstract boolean hasContent(RenderContext context);

    /**
     * Renders this node and its children.
     *
     * @param level heading level of this node
     * @param context render context
     * @return rendered lines, empty if the node has no content
     */
    public abstract List<String> render(int level, RenderContext context);

    /**
     * Heading text this node renders under, used to keep sibling headings apart.
     *
     * @param context render context
     * @return heading text, empty for nodes without a heading or without content
     */
    public Optional<String> renderedHeading(RenderContext context) {
        return Optional.empty();
    }
}
