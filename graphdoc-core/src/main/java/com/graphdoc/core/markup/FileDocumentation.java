package com.graphdoc.core.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Side table of the section markup found in one file.
 *
 * <p>Headline markup is grouped by section. Node markup is keyed by node id, so the model
 * records stay untouched.
 */
public final class FileDocumentation {

    private static final FileDocumentation EMPTY = new FileDocumentation(Map.of(), Map.of());

    private final Map<Section, List<SectionMarkup>> headlines;
    private final Map<String, List<SectionMarkup>> nodes;

    FileDocumentation(Map<Section, List<SectionMarkup>> headlines, Map<String, List<SectionMarkup>> nodes) {
        Map<Section, List<SectionMarkup>> headlineCopy = new EnumMap<>(Section.class);
        headlines.forEach((section, markups) -> headlineCopy.put(section, List.copyOf(markups)));
        Map<String, List<SectionMarkup>> nodeCopy = new LinkedHashMap<>();
        nodes.forEach((nodeId, markups) -> nodeCopy.put(nodeId, List.copyOf(markups)));
        this.headlines = Collections.unmodifiableMap(headlineCopy);
        this.nodes = Collections.unmodifiableMap(nodeCopy);
    }

    public static FileDocumentation empty() {
        return EMPTY;
    }

    /**
     * Markup attached to the file for a section, in render order.
     *
     * @param section headline section
     * @return markup list, empty if none
     */
    public List<SectionMarkup> sectionMarkups(Section section) {
        return headlines.getOrDefault(section, List.of());
    }

    /**
     * Markup linked to a node.
     *
     * @param nodeId node id
     * @return markup list, empty if none
     */
    public List<SectionMarkup> nodeMarkups(String nodeId) {
        return nodes.getOrDefault(nodeId, List.of());
    }

    /**
     * Markup of one section linked to a node.
     *
     * @param nodeId node id
     * @param section section to select
     * @return markup list, empty if none
     */
    public List<SectionMarkup> nodeMarkups(String nodeId, Section section) {
        List<SectionMarkup> selected = new ArrayList<>();
        for (SectionMarkup markup : nodeMarkups(nodeId)) {
            if (markup.section() == section) {
                selected.add(markup);
            }
        }
        return selected;
    }

    /**
     * Ids of the nodes carrying markup of a section.
     *
     * @param section node section
     * @return node ids in link order
     */
    public Set<String> linkedNodeIds(Section section) {
        Set<String> ids = new LinkedHashSet<>();
        nodes.forEach((nodeId, markups) -> {
            if (markups.stream().anyMatch(markup -> markup.section() == section)) {
                ids.add(nodeId);
            }
        });
        return ids;
    }

    /**
     * Total number of parsed markups.
     *
     * @return headline markups plus node links
     */
    public int size() {
        int count = 0;
        for (List<SectionMarkup> markups : headlines.values()) {
            count += markups.size();
        }
        for (List<SectionMarkup> markups : nodes.values()) {
            count += markups.size();
        }
        return count;
    }
}
