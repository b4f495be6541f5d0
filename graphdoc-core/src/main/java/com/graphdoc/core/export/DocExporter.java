package com.graphdoc.core.export;

import java.nio.file.Path;
import java.util.List;

/**
 * Format backend producing the primitives of a documentation file.
 *
 * <p>Every structure an exporter emits must be recognizable again by the same exporter:
 * {@link #isHeading(String)} classifies every line produced by {@link #heading(String, int)}
 * and {@link #tableRanges(List)} finds every table produced by {@link #asTable(List, List)}.
 * The merge of manual documentation depends on this round trip.
 *
 * <p><b>Implementation Guidelines:</b>
 * <ul>
 *   <li>Outputs are line lists without line terminators</li>
 *   <li>Cell and heading text is escaped by the exporter, never by callers</li>
 *   <li>Output must be deterministic for equal input</li>
 * </ul>
 */
public interface DocExporter {

    /**
     * File extension of the documents, without dot.
     *
     * @return extension, e.g. {@code org}
     */
    String fileExtension();

    /**
     * Document preamble written before the title.
     *
     * @return preamble lines, may be empty
     */
    List<String> docHead();

    /**
     * Document title line.
     *
     * @param displayName title text
     * @return title lines
     */
    List<String> title(String displayName);

    /**
     * Heading line at a nesting level.
     *
     * @param text heading text
     * @param level nesting level, 1 for top level
     * @return heading line
     */
    String heading(String text, int level);

    /**
     * Returns whether a line is a heading of any level.
     *
     * @param line line of a document
     * @return true for heading lines
     */
    boolean isHeading(String line);

    /**
     * Renders a table with padded columns.
     *
     * @param header header cells, null for a table without header
     * @param rows data rows
     * @return table lines
     */
    List<String> asTable(List<String> header, List<List<String>> rows);

    /**
     * Finds the tables in a list of lines.
     *
     * @param lines document lines
     * @return table ranges in line order
     */
    List<TableRange> tableRanges(List<String> lines);

    /**
     * Renders an unordered list.
     *
     * @param values list entries
     * @return list lines
     */
    List<String> asList(List<String> values);

    /**
     * Renders a code block.
     *
     * @param code source code
     * @param language language name
     * @param indent number of spaces replacing a tab
     * @return code block lines
     */
    List<String> asCode(String code, String language, int indent);

    /**
     * Renders free text so that no line is mistaken for structure.
     *
     * @param lines text lines
     * @return escaped lines
     */
    List<String> asText(List<String> lines);

    /**
     * Link to another file, relative to the linking document.
     *
     * @param target linked file
     * @param relativeTo document containing the link
     * @param label link label
     * @return link markup
     */
    String fileLink(Path target, Path relativeTo, String label);

    /**
     * Link to a URL.
     *
     * @param url target url
     * @param label link label, may be blank
     * @return link markup
     */
    String urlLink(String url, String label);

    /**
     * Link to a heading of the same document.
     *
     * @param heading heading text
     * @param label link label
     * @return link markup
     */
    String headingLink(String heading, String label);

    /**
     * Finds the lines containing a file link.
     *
     * @param lines document lines
     * @return line indexes in order
     */
    List<Integer> linkIndexes(List<String> lines);
}
