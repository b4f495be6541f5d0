package com.graphdoc.core.content;

import java.util.List;

/**
 * Plain heading grouping other content, optionally with a model body.
 *
 * <p>Optional groups vanish when all children are empty.
 */
public class GroupContent extends HeadingContent {

    private final String title;
    private final boolean optional;
    private final List<ContentNode> children;

    public GroupContent(String title, boolean optional, List<ContentNode> children) {
        this.title = title;
        this.optional = optional;
        this.children = List.copyOf(children);
    }

    @Override
    protected String headingText(RenderContext context) {
        return title;
    }

    @Override
    protected boolean isOptional() {
        return optional;
    }

    @Override
    protected List<ContentNode> children(RenderContext context) {
        return children;
    }
}
