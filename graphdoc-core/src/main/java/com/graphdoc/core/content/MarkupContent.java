package com.graphdoc.core.content;

import com.graphdoc.core.markup.SectionMarkup;

import java.util.List;
import java.util.Objects;

/**
 * Section text an author placed on the canvas, rendered under its own title.
 */
public class MarkupContent extends HeadingContent {

    private final SectionMarkup markup;
    private final String heading;

    /**
     * Creates markup content. The heading differs from the markup title when a sibling
     * heading already uses that title.
     *
     * @param markup section text
     * @param heading heading text
     */
    public MarkupContent(SectionMarkup markup, String heading) {
        this.markup = Objects.requireNonNull(markup, "markup must not be null");
        this.heading = heading;
    }

    @Override
    protected String headingText(RenderContext context) {
        return heading;
    }

    @Override
    protected String defaultHeading() {
        return markup.section().title();
    }

    @Override
    protected List<String> body(RenderContext context) {
        return context.exporter().asText(markup.body());
    }
}
