package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.content.RenderContext;
import com.graphdoc.core.model.GraphNode;

import java.util.List;

/**
 * Kind-specific part of a node documentation.
 *
 * <p>Renderers are tried in list order and the first supporting one wins, see
 * {@link NodeDetailRenderers}.
 */
public interface NodeDetailRenderer {

    /**
     * Short renderer name, used in logs.
     *
     * @return name
     */
    String name();

    /**
     * Returns whether this renderer handles the node.
     *
     * @param node node to render
     * @return true if supported
     */
    boolean supports(GraphNode node);

    /**
     * Kind-specific rows of the node table.
     *
     * @param node node to render
     * @return table rows
     */
    List<InformationContent.Row> rows(GraphNode node);

    /**
     * Lines rendered after the node table, e.g. source code.
     *
     * @param node node to render
     * @param context render context
     * @return extra lines
     */
    default List<String> extra(GraphNode node, RenderContext context) {
        return List.of();
    }
}
