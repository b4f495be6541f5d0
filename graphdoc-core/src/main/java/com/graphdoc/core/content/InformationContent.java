package com.graphdoc.core.content;

import com.graphdoc.core.content.merge.ManualCleanup;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Fixed key/value table, followed by the text the author wrote below it.
 */
public class InformationContent extends HeadingContent {

    private final String title;
    private final Function<RenderContext, List<Row>> rows;
    private final List<ContentNode> children;

    /**
     * Creates an information block.
     *
     * @param title heading text
     * @param rows key/value rows of the table
     * @param children child content
     */
    public InformationContent(String title, Function<RenderContext, List<Row>> rows, List<ContentNode> children) {
        this.title = title;
        this.rows = rows;
        this.children = List.copyOf(children);
    }

    @Override
    protected String headingText(RenderContext context) {
        return title;
    }

    @Override
    protected List<String> body(RenderContext context) {
        List<List<String>> tableRows = new ArrayList<>();
        for (Row row : rows.apply(context)) {
            tableRows.add(List.of(row.key(), context.values().format(row.value())));
        }
        return context.exporter().asTable(null, tableRows);
    }

    @Override
    protected ManualMode manualMode() {
        return ManualMode.APPEND;
    }

    @Override
    protected Set<ManualCleanup> manualCleanups() {
        return Set.of(ManualCleanup.STRIP_FIRST_TABLE);
    }

    @Override
    protected List<ContentNode> children(RenderContext context) {
        return children;
    }

    /**
     * Table row, a null value renders as the default value.
     *
     * @param key row label
     * @param value row value
     */
    public record Row(String key, String value) {
    }
}
