package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;

/**
 * Calls of custom node definitions.
 */
public class CustomReferenceRenderer implements NodeDetailRenderer {

    @Override
    public String name() {
        return "custom";
    }

    @Override
    public boolean supports(GraphNode node) {
        return node.details() instanceof NodeDetails.CustomReference;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        NodeDetails.CustomReference reference = (NodeDetails.CustomReference) node.details();
        return List.of(new InformationContent.Row("Custom node", reference.functionUuid()));
    }
}
