package com.graphdoc.core.content.merge;

import com.graphdoc.core.export.DocExporter;
import com.graphdoc.core.export.TableRange;
import com.graphdoc.core.util.TextLines;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Recovers author-written text from a previously rendered block.
 *
 * <p>Placeholder lines are dropped, regenerated parts are removed as requested, and the
 * result is blank-trimmed. An empty result becomes the placeholder, so the next run finds
 * a stable line under the heading.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ManualDocs manual = new ManualDocs(exporter, "# (no manual documentation)");
 * List<String> text = manual.recover(block, Set.of(ManualCleanup.STRIP_FIRST_TABLE));
 * }</pre>
 */
public class ManualDocs {

    private final DocExporter exporter;
    private final String placeholder;

    public ManualDocs(DocExporter exporter, String placeholder) {
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        if (placeholder == null || placeholder.isBlank()) {
            throw new IllegalArgumentException("placeholder must not be blank");
        }
        this.placeholder = placeholder.strip();
    }

    public String placeholder() {
        return placeholder;
    }

    /**
     * Recovers manual text, falling back to the placeholder.
     *
     * @param block previous block under the heading
     * @param cleanups regenerated parts to remove
     * @return manual text or the placeholder line
     */
    public List<String> recover(List<String> block, Set<ManualCleanup> cleanups) {
        List<String> manual = recoverOrEmpty(block, cleanups);
        return manual.isEmpty() ? List.of(placeholder) : manual;
    }

    /**
     * Recovers manual text without placeholder fallback.
     *
     * @param block previous block under the heading
     * @param cleanups regenerated parts to remove
     * @return manual text, empty if the author wrote nothing
     */
    public List<String> recoverOrEmpty(List<String> block, Set<ManualCleanup> cleanups) {
        List<String> lines = new ArrayList<>(block);
        if (cleanups.contains(ManualCleanup.STRIP_FIRST_TABLE)) {
            List<TableRange> ranges = exporter.tableRanges(lines);
            if (!ranges.isEmpty()) {
                TableRange first = ranges.get(0);
                lines.subList(first.start(), first.end()).clear();
            }
        }
        lines.removeIf(this::isPlaceholder);
        return TextLines.stripBlank(lines);
    }

    /**
     * Returns whether a line is the placeholder.
     *
     * @param line line to test
     * @return true for the placeholder line
     */
    public boolean isPlaceholder(String line) {
        return line.strip().equals(placeholder);
    }
}
