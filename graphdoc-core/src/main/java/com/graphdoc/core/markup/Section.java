package com.graphdoc.core.markup;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;

import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Documentation sections authors can address from annotation and group text.
 *
 * <p>Each section has a heading title, a marker recognized at the start of a line and a
 * predicate deciding which nodes of a file belong to it.
 *
 * <p><b>Example annotation text:</b>
 * <pre>{@code
 * [W] Slow on large models
 * Runs once per element, expect minutes on big projects.
 * }</pre>
 */
public enum Section {
    DESCRIPTION("Description", "[D]", SectionScope.HEADLINE, (file, node) -> false),
    TUTORIAL("Tutorial", "[T]", SectionScope.HEADLINE, (file, node) -> false),
    SOLUTION("Problem / Solution", "[P]", SectionScope.HEADLINE, (file, node) -> false),
    INPUT("Input", "[I]", SectionScope.HEADLINE, GraphFile::isInput),
    OUTPUT("Output", "[O]", SectionScope.HEADLINE, GraphFile::isOutput),
    FILES("Files", "[F]", SectionScope.HEADLINE, (file, node) -> node.kind().isPath()),
    WARNINGS("Warnings", "[W]", SectionScope.NODE, (file, node) -> true);

    private final String title;
    private final String marker;
    private final SectionScope scope;
    private final BiPredicate<GraphFile, GraphNode> membership;

    Section(String title, String marker, SectionScope scope, BiPredicate<GraphFile, GraphNode> membership) {
        this.title = title;
        this.marker = marker;
        this.scope = scope;
        this.membership = membership;
    }

    public String title() {
        return title;
    }

    public String marker() {
        return marker;
    }

    public SectionScope scope() {
        return scope;
    }

    /**
     * Returns whether a node belongs to this section.
     *
     * @param file file containing the node
     * @param node node to test
     * @return true if the node is listed under this section
     */
    public boolean belongs(GraphFile file, GraphNode node) {
        return membership.test(file, node);
    }

    /**
     * Finds the section whose marker starts the given line.
     *
     * @param line text line, leading whitespace is ignored
     * @return matching section
     */
    public static Optional<Section> ofLine(String line) {
        String stripped = line.stripLeading();
        for (Section section : values()) {
            if (stripped.startsWith(section.marker)) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
