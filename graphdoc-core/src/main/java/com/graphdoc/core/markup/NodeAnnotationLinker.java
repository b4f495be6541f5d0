package com.graphdoc.core.markup;

import com.graphdoc.core.model.Annotation;
import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.Group;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves which part of a file each piece of section markup documents.
 *
 * <p>Headline markup is attached to the file and ordered by its order hint (markup without
 * a hint goes last), then by encounter order with groups before annotations. Node markup
 * from an annotation goes to the nearest node by Euclidean distance; on equal distance the
 * node enumerated first wins. Node markup from a group goes to its members.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FileDocumentation docs = new NodeAnnotationLinker().link(script);
 * docs.nodeMarkups(node.id(), Section.WARNINGS);
 * }</pre>
 */
public class NodeAnnotationLinker {

    private static final Logger log = LoggerFactory.getLogger(NodeAnnotationLinker.class);

    private static final Comparator<SectionMarkup> BY_ORDER_HINT = Comparator.comparing(
        SectionMarkup::order, Comparator.nullsLast(Comparator.naturalOrder()));

    private final SectionMarkupParser parser;

    public NodeAnnotationLinker() {
        this(new SectionMarkupParser());
    }

    public NodeAnnotationLinker(SectionMarkupParser parser) {
        this.parser = parser;
    }

    /**
     * Builds the markup side table of a file.
     *
     * @param file parsed graph file
     * @return linked markup
     * @throws UnresolvedAnnotationException if node markup exists in a file without nodes
     */
    public FileDocumentation link(GraphFile file) {
        Map<Section, List<SectionMarkup>> headlines = new EnumMap<>(Section.class);
        Map<String, List<SectionMarkup>> nodes = new LinkedHashMap<>();

        for (Group group : file.groups()) {
            Optional<SectionMarkup> markup = parser.parse(groupText(group), group.id());
            if (markup.isEmpty()) {
                continue;
            }
            if (markup.get().section().scope() == SectionScope.HEADLINE) {
                headlines.computeIfAbsent(markup.get().section(), section -> new ArrayList<>()).add(markup.get());
            } else {
                linkMembers(file, group, markup.get(), nodes);
            }
        }

        for (Annotation annotation : file.annotations()) {
            Optional<SectionMarkup> markup = parser.parse(annotationText(annotation), annotation.id());
            if (markup.isEmpty()) {
                continue;
            }
            if (markup.get().section().scope() == SectionScope.HEADLINE) {
                headlines.computeIfAbsent(markup.get().section(), section -> new ArrayList<>()).add(markup.get());
            } else {
                GraphNode nearest = nearestNode(file, annotation);
                nodes.computeIfAbsent(nearest.id(), id -> new ArrayList<>()).add(markup.get());
                log.debug("Linked annotation {} to node {} ({})", annotation.id(), nearest.id(), nearest.name());
            }
        }

        // stable sort keeps encounter order for equal hints
        headlines.values().forEach(markups -> markups.sort(BY_ORDER_HINT));
        return new FileDocumentation(headlines, nodes);
    }

    /**
     * Finds the node closest to an annotation.
     *
     * @param file file containing the annotation
     * @param annotation annotation to place
     * @return nearest node, the first enumerated one on ties
     * @throws UnresolvedAnnotationException if the file has no nodes
     */
    public GraphNode nearestNode(GraphFile file, Annotation annotation) {
        GraphNode nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (GraphNode node : file.nodes()) {
            double distance = node.distanceTo(annotation.x(), annotation.y());
            if (nearest == null || distance < nearestDistance) {
                nearest = node;
                nearestDistance = distance;
            }
        }
        if (nearest == null) {
            throw new UnresolvedAnnotationException(file.path(), annotationText(annotation));
        }
        return nearest;
    }

    private void linkMembers(GraphFile file, Group group, SectionMarkup markup, Map<String, List<SectionMarkup>> nodes) {
        Set<String> fileNodeIds = file.nodes().stream().map(GraphNode::id).collect(Collectors.toSet());
        for (String memberId : group.memberIds()) {
            if (!fileNodeIds.contains(memberId)) {
                log.debug("Group {} references unknown node {} in {}", group.id(), memberId, file.path());
                continue;
            }
            nodes.computeIfAbsent(memberId, id -> new ArrayList<>()).add(markup);
        }
    }

    private static String groupText(Group group) {
        return joinText(group.title(), group.text());
    }

    private static String annotationText(Annotation annotation) {
        if (annotation.text() == null || annotation.text().isBlank()) {
            return annotation.title() == null ? "" : annotation.title();
        }
        return joinText(annotation.title(), annotation.text());
    }

    private static String joinText(String title, String text) {
        if (title == null || title.isBlank()) {
            return text == null ? "" : text;
        }
        if (text == null || text.isBlank()) {
            return title;
        }
        return title + "\n" + text;
    }
}
