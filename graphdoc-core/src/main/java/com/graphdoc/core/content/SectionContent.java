package com.graphdoc.core.content;

import com.graphdoc.core.content.merge.ManualCleanup;
import com.graphdoc.core.markup.Section;
import com.graphdoc.core.markup.SectionMarkup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Heading of a documentation section.
 *
 * <p>Children are the markup authors attached to the section, followed by the fixed
 * children of the layout. The body comes from the model where the section has model
 * content (a file description, a link to the previous script), otherwise it is manual text.
 */
public class SectionContent extends HeadingContent {

    private final Section section;
    private final Function<RenderContext, List<String>> modelBody;
    private final ManualMode manualMode;
    private final Set<ManualCleanup> cleanups;
    private final List<ContentNode> fixedChildren;
    private final BiPredicate<RenderContext, String> regeneratedLine;

    /**
     * Creates a section without model body.
     *
     * @param section documented section
     * @param fixedChildren children after the section markup
     */
    public SectionContent(Section section, List<ContentNode> fixedChildren) {
        this(section, context -> List.of(), ManualMode.FALLBACK, Set.of(), fixedChildren);
    }

    /**
     * Creates a section.
     *
     * @param section documented section
     * @param modelBody body computed from the model
     * @param manualMode combination with recovered text
     * @param cleanups regenerated parts removed from recovered text
     * @param fixedChildren children after the section markup
     */
    public SectionContent(Section section, Function<RenderContext, List<String>> modelBody, ManualMode manualMode,
                          Set<ManualCleanup> cleanups, List<ContentNode> fixedChildren) {
        this(section, modelBody, manualMode, cleanups, fixedChildren, (context, line) -> false);
    }

    /**
     * Creates a section whose model body is a single line written back into the previous run.
     *
     * @param section documented section
     * @param modelBody body computed from the model
     * @param manualMode combination with recovered text
     * @param cleanups regenerated parts removed from recovered text
     * @param fixedChildren children after the section markup
     * @param regeneratedLine matches the line the model body wrote in the previous run
     */
    public SectionContent(Section section, Function<RenderContext, List<String>> modelBody, ManualMode manualMode,
                          Set<ManualCleanup> cleanups, List<ContentNode> fixedChildren,
                          BiPredicate<RenderContext, String> regeneratedLine) {
        this.section = Objects.requireNonNull(section, "section must not be null");
        this.modelBody = modelBody;
        this.manualMode = manualMode;
        this.cleanups = Set.copyOf(cleanups);
        this.fixedChildren = List.copyOf(fixedChildren);
        this.regeneratedLine = Objects.requireNonNull(regeneratedLine, "regeneratedLine must not be null");
    }

    public Section section() {
        return section;
    }

    @Override
    protected String headingText(RenderContext context) {
        return section.title();
    }

    @Override
    protected List<String> body(RenderContext context) {
        return modelBody.apply(context);
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
    protected boolean isRegeneratedLine(RenderContext context, String line) {
        return regeneratedLine.test(context, line);
    }

    @Override
    protected List<ContentNode> children(RenderContext context) {
        Set<String> taken = new HashSet<>();
        fixedChildren.forEach(child -> child.renderedHeading(context).ifPresent(taken::add));
        List<ContentNode> children = new ArrayList<>();
        for (SectionMarkup markup : context.documentation().sectionMarkups(section)) {
            String heading = HeadingText.unique(
                HeadingText.canonical(markup.title(), section.title()), section.title(), taken);
            taken.add(heading);
            children.add(new MarkupContent(markup, heading));
        }
        children.addAll(fixedChildren);
        return children;
    }
}
