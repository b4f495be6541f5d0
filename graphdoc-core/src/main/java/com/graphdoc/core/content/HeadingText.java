package com.graphdoc.core.content;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical heading texts.
 *
 * <p>Headings are the merge key between runs, so every heading text goes through here:
 * whitespace is collapsed, blank values get a fallback, and node names that occur more
 * than once in a file get a short id suffix.
 */
public final class HeadingText {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int SHORT_ID_LENGTH = 8;

    private HeadingText() {
        // Utility class
    }

    /**
     * Canonicalizes heading text.
     *
     * @param text raw text
     * @param fallback text used when the raw text is blank
     * @return canonical text
     */
    public static String canonical(String text, String fallback) {
        String value = text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
        return value.isEmpty() ? fallback : value;
    }

    /**
     * Display name of a file or package: underscores become spaces.
     *
     * @param name raw name
     * @param fallback text used when the name is blank
     * @return display name
     */
    public static String displayName(String name, String fallback) {
        return canonical(name == null ? null : name.replace('_', ' '), fallback);
    }

    /**
     * Heading of a node, unique within its file.
     *
     * @param file file containing the node
     * @param node node
     * @return node heading text
     */
    public static String node(GraphFile file, GraphNode node) {
        String name = nodeName(node);
        long sameName = file.nodes().stream()
            .filter(other -> nodeName(other).equals(name))
            .count();
        if (sameName < 2) {
            return name;
        }
        String id = node.id().replace("-", "");
        return name + " (" + id.substring(0, Math.min(SHORT_ID_LENGTH, id.length())) + ")";
    }

    /**
     * Heading distinct from the sibling headings already taken. A taken heading gets the
     * qualifier in parentheses, and a counter when that is taken too.
     *
     * @param heading canonical heading
     * @param qualifier text added to a taken heading
     * @param taken sibling headings
     * @return heading not contained in {@code taken}
     */
    public static String unique(String heading, String qualifier, Set<String> taken) {
        if (!taken.contains(heading)) {
            return heading;
        }
        String candidate = heading + " (" + qualifier + ")";
        for (int counter = 2; taken.contains(candidate); counter++) {
            candidate = heading + " (" + qualifier + " " + counter + ")";
        }
        return candidate;
    }

    private static String nodeName(GraphNode node) {
        return canonical(node.name().replace('[', '(').replace(']', ')'), "Node");
    }
}
