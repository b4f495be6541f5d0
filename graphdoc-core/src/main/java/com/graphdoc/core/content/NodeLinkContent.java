package com.graphdoc.core.content;

import com.graphdoc.core.model.GraphFile;
import com.graphdoc.core.model.GraphNode;

/**
 * Heading linking to the current node, for nodes documented elsewhere in the document.
 * Text written under the link is kept like any other manual text.
 */
public class NodeLinkContent extends HeadingContent {

    @Override
    protected String headingText(RenderContext context) {
        String nodeHeading = HeadingText.node(context.model(GraphFile.class), context.require(GraphNode.class));
        return context.exporter().headingLink(nodeHeading, nodeHeading);
    }
}
