package com.graphdoc.core.content.merge;

import com.graphdoc.core.export.DocExporter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the text a previous run wrote under a heading.
 *
 * <p>Pure function over the previous lines: the first line equal to the heading
 * (trailing whitespace ignored) opens the block, the next line the exporter recognizes as
 * a heading of any level closes it.
 */
public class ExistingContentExtractor {

    private final DocExporter exporter;

    public ExistingContentExtractor(DocExporter exporter) {
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
    }

    /**
     * Extracts the block under a heading line.
     *
     * @param previousLines lines to search
     * @param headingLine heading line as the exporter renders it
     * @return block and remainder, empty if the heading is not found
     */
    public Optional<ExistingBlock> extract(List<String> previousLines, String headingLine) {
        String wanted = headingLine.stripTrailing();
        for (int index = 0; index < previousLines.size(); index++) {
            if (!previousLines.get(index).stripTrailing().equals(wanted)) {
                continue;
            }
            int end = index + 1;
            while (end < previousLines.size() && !exporter.isHeading(previousLines.get(end))) {
                end++;
            }
            return Optional.of(new ExistingBlock(
                previousLines.subList(index + 1, end),
                previousLines.subList(end, previousLines.size())));
        }
        return Optional.empty();
    }
}
