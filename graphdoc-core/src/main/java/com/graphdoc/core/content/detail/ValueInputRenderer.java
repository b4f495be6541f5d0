package com.graphdoc.core.content.detail;

import com.graphdoc.core.content.InformationContent;
import com.graphdoc.core.model.GraphNode;
import com.graphdoc.core.model.NodeDetails;

import java.util.List;

/**
 * Selection and core input nodes: the configured value.
 */
public class ValueInputRenderer implements NodeDetailRenderer {

    @Override
    public String name() {
        return "value";
    }

    @Override
    public boolean supports(GraphNode node) {
        return node.details() instanceof NodeDetails.Selection || node.details() instanceof NodeDetails.InputValue;
    }

    @Override
    public List<InformationContent.Row> rows(GraphNode node) {
        if (node.details() instanceof NodeDetails.Selection selection) {
            return List.of(new InformationContent.Row("Selected", selection.selected()));
        }
        NodeDetails.InputValue input = (NodeDetails.InputValue) node.details();
        return List.of(new InformationContent.Row("Value", input.value()));
    }
}
