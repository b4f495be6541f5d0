package com.graphdoc.core.content;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Document preamble and title. Has no heading and ignores the level.
 */
public class TitleContent extends ContentNode {

    private final Function<RenderContext, String> title;

    public TitleContent(Function<RenderContext, String> title) {
        this.title = title;
    }

    @Override
    public boolean hasContent(RenderContext context) {
        return true;
    }

    @Override
    public List<String> render(int level, RenderContext context) {
        List<String> lines = new ArrayList<>(context.exporter().docHead());
        lines.addAll(context.exporter().title(title.apply(context)));
        return lines;
    }
}
