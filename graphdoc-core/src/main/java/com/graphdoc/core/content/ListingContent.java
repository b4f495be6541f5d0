package com.graphdoc.core.content;

import java.util.List;
import java.util.function.Function;

/**
 * Optional heading with one child per listed item.
 *
 * <p>Without items the whole listing is left out, there is no empty heading.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * new ListingContent<>("Python Nodes",
 *     context -> context.model(GraphFile.class).nodesOf(NodeKind.PYTHON_SCRIPT),
 *     context -> new NodeDetailContent(renderers));
 * }</pre>
 *
 * @param <T> item type
 */
public class ListingContent<T> extends HeadingContent {

    private final String title;
    private final Function<RenderContext, List<T>> items;
    private final Function<T, ContentNode> itemContent;

    /**
     * Creates a listing.
     *
     * @param title heading text
     * @param items items of the rendered document
     * @param itemContent content node rendering one item, bound to the item
     */
    public ListingContent(String title, Function<RenderContext, List<T>> items, Function<T, ContentNode> itemContent) {
        this.title = title;
        this.items = items;
        this.itemContent = itemContent;
    }

    @Override
    protected String headingText(RenderContext context) {
        return title;
    }

    @Override
    protected boolean isOptional() {
        return true;
    }

    @Override
    protected List<ContentNode> children(RenderContext context) {
        return items.apply(context).stream()
            .map(item -> (ContentNode) new ItemContent(itemContent.apply(item), item))
            .toList();
    }
}
