package com.graphdoc.core.content;

import java.util.ArrayList;
import java.util.List;

/**
 * Root content nodes of one document.
 */
public class ContentDocument {

    private final List<ContentNode> roots;

    public ContentDocument(List<ContentNode> roots) {
        this.roots = List.copyOf(roots);
    }

    public List<ContentNode> roots() {
        return roots;
    }

    /**
     * Renders all roots at top level.
     *
     * @param context root context of the document
     * @return document lines
     */
    public List<String> render(RenderContext context) {
        List<String> lines = new ArrayList<>();
        for (ContentNode root : roots) {
            lines.addAll(root.render(1, context));
        }
        return lines;
    }
}
