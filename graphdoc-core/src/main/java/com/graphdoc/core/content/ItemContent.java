package com.graphdoc.core.content;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Binds a listing item to a content node.
 */
public class ItemContent extends ContentNode {

    private final ContentNode delegate;
    private final Object item;

    public ItemContent(ContentNode delegate, Object item) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.item = Objects.requireNonNull(item, "item must not be null");
    }

    @Override
    public boolean hasContent(RenderContext context) {
        return delegate.hasContent(context.withItem(item));
    }

    @Override
    public Optional<String> renderedHeading(RenderContext context) {
        return delegate.renderedHeading(context.withItem(item));
    }

    @Override
    public List<String> render(int level, RenderContext context) {
        return delegate.render(level, context.withItem(item));
    }
}
